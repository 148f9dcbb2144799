package com.vibecoding.fleetcatalog.client;

import com.vibecoding.fleetcatalog.exception.FleetApiException;
import com.vibecoding.fleetcatalog.model.FleetClusterConfig;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 설정으로부터 fabric8 KubernetesClient 생성
 */
@Component
public class KubernetesClientFactory {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientFactory.class);

    private static final int REQUEST_TIMEOUT_MS = 30000;
    private static final int CONNECTION_TIMEOUT_MS = 10000;

    /**
     * Fleet 관리 클러스터용 CRD 클라이언트
     */
    public FleetResourceClient createResourceClient(FleetClusterConfig cluster) {
        KubernetesClient client = createClient(cluster.getUrl(), cluster.getToken(), cluster.getCaData(),
                cluster.isSkipTlsVerify());
        return new Fabric8FleetResourceClient(cluster.getName(), client);
    }

    /**
     * URL + Bearer 토큰으로 클라이언트 생성. ~/.kube/config 는 읽지 않는다.
     *
     * @throws FleetApiException 설정이 잘못된 경우
     */
    public KubernetesClient createClient(String url, String token, String caData, boolean skipTlsVerify) {
        if (url == null || url.isBlank()) {
            throw new FleetApiException("Kubernetes API URL is required");
        }
        try {
            ConfigBuilder builder = new ConfigBuilder()
                    .withAutoConfigure(false)
                    .withMasterUrl(url)
                    .withOauthToken(token)
                    .withTrustCerts(skipTlsVerify)
                    .withDisableHostnameVerification(skipTlsVerify)
                    .withRequestTimeout(REQUEST_TIMEOUT_MS)
                    .withConnectionTimeout(CONNECTION_TIMEOUT_MS);
            if (caData != null && !caData.isBlank()) {
                builder.withCaCertData(caData);
            }
            Config config = builder.build();

            return new KubernetesClientBuilder()
                    .withConfig(config)
                    .build();
        } catch (Exception e) {
            log.error("Failed to create Kubernetes client for {}", url, e);
            throw new FleetApiException("Invalid cluster configuration: " + e.getMessage(), e);
        }
    }
}
