package com.ryuqq.railway.application.scheduler;

import com.ryuqq.railway.core.model.Manifest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Manifest 의존 관계 인덱스.
 *
 * <p>dependsOnManifestId 정수 FK만으로 부모/자식 인덱스를 만들고 BFS로 탐색합니다.
 * Manifest 객체 그래프를 따라가지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManifestDependencyGraph {

    private final Map<Long, Long> parentOf = new HashMap<>();
    private final Map<Long, List<Long>> childrenOf = new HashMap<>();

    private ManifestDependencyGraph() {
    }

    public static ManifestDependencyGraph of(Collection<Manifest> manifests) {
        ManifestDependencyGraph graph = new ManifestDependencyGraph();
        for (Manifest manifest : manifests) {
            Long parentId = manifest.getDependsOnManifestId();
            if (manifest.getId() != null && parentId != null) {
                graph.parentOf.put(manifest.getId(), parentId);
                graph.childrenOf.computeIfAbsent(parentId, id -> new ArrayList<>()).add(manifest.getId());
            }
        }
        return graph;
    }

    /**
     * 부모 방향으로 따라가다 시작점으로 돌아오면 그 경로를 반환.
     *
     * @param manifestId 시작 Manifest id
     * @return 순환 경로 (시작 id부터, 순환이 없으면 empty)
     */
    public Optional<List<Long>> findCycle(long manifestId) {
        List<Long> path = new ArrayList<>();
        Set<Long> visited = new LinkedHashSet<>();
        Long current = manifestId;
        while (current != null && visited.add(current)) {
            path.add(current);
            current = parentOf.get(current);
        }
        if (current != null && current == manifestId) {
            path.add(manifestId);
            return Optional.of(path);
        }
        return Optional.empty();
    }

    /**
     * 모든 하위 Manifest id (BFS 순서, 자기 자신 제외).
     *
     * @param manifestId 시작 Manifest id
     * @return 하위 id 집합
     */
    public Set<Long> descendants(long manifestId) {
        Set<Long> result = new LinkedHashSet<>();
        Deque<Long> queue = new ArrayDeque<>(childrenOf.getOrDefault(manifestId, List.of()));
        while (!queue.isEmpty()) {
            Long next = queue.poll();
            if (next != manifestId && result.add(next)) {
                queue.addAll(childrenOf.getOrDefault(next, List.of()));
            }
        }
        return result;
    }

    public List<Long> children(long manifestId) {
        return List.copyOf(childrenOf.getOrDefault(manifestId, List.of()));
    }
}
