package com.vibecoding.fleetcatalog.client;

import com.vibecoding.fleetcatalog.model.FetchResult;
import com.vibecoding.fleetcatalog.model.fleet.Bundle;
import com.vibecoding.fleetcatalog.model.fleet.BundleDeployment;
import com.vibecoding.fleetcatalog.model.fleet.FleetCluster;
import com.vibecoding.fleetcatalog.model.fleet.GitRepo;

import java.util.List;
import java.util.Optional;

/**
 * Fleet 관리 클러스터의 CRD 조회 클라이언트
 *
 * 호출 실패는 예외 대신 {@link FetchResult#failure(Exception)} 로 반환한다.
 */
public interface FleetResourceClient extends AutoCloseable {

    /**
     * @param labelSelector "k=v,..." 형식, null 이면 전체
     */
    FetchResult<List<GitRepo>> listGitRepos(String namespace, String labelSelector);

    FetchResult<Optional<GitRepo>> getGitRepo(String namespace, String name);

    /**
     * fleet.cattle.io/repo-name 라벨로 GitRepo 에 속한 Bundle 조회
     */
    FetchResult<List<Bundle>> listBundlesForGitRepo(String namespace, String gitRepoName);

    FetchResult<Optional<Bundle>> getBundle(String namespace, String name);

    /**
     * fleet.cattle.io/bundle-name 라벨로 모든 네임스페이스에서 조회
     */
    FetchResult<List<BundleDeployment>> listBundleDeploymentsForBundle(String bundleName);

    FetchResult<Optional<BundleDeployment>> getBundleDeployment(String namespace, String name);

    /**
     * Fleet 워크스페이스에 등록된 다운스트림 Cluster CR
     */
    FetchResult<List<FleetCluster>> listClusters(String namespace);

    @Override
    void close();
}
