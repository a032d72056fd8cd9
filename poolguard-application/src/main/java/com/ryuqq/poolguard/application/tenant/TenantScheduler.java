package com.ryuqq.poolguard.application.tenant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * 우선순위 기반 테넌트 스케줄러.
 *
 * <p>우선순위 값이 높은 그룹이 항상 먼저 선택되는 strict-priority 방식이며,
 * 같은 우선순위 그룹 안에서는 round-robin으로 공정성을 보장합니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>가장 높은 우선순위의 비어 있지 않은 그룹에서 선택</li>
 *   <li>그룹은 회전 커서를 유지하며, N개 테넌트를 모두 한 번씩 반환한 뒤에 처음으로 돌아옴</li>
 *   <li>다른 우선순위 그룹 간에는 가중 공정성이 없음 (하위 그룹은 상위 그룹이 비어야 선택됨)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 그룹 선택과 커서 이동은 인스턴스 monitor 하나로 보호합니다.
 * 스케줄링 결정은 빈도가 낮아 coarse-grained lock을 사용합니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TenantScheduler {

    private final NavigableMap<Integer, PriorityGroup> groups = new TreeMap<>(Collections.reverseOrder());
    private final Map<String, Integer> priorityIndex = new HashMap<>();

    /**
     * 테넌트 추가.
     *
     * <p>이미 같은 우선순위 그룹에 있으면 TenantInfo만 교체하고 순서는 유지합니다.
     * 다른 우선순위로 바뀌었으면 새 그룹의 끝으로 이동합니다.</p>
     *
     * @param info 테넌트 정보
     * @throws IllegalArgumentException info가 null인 경우
     */
    public synchronized void addTenant(TenantInfo info) {
        if (info == null) {
            throw new IllegalArgumentException("info cannot be null");
        }
        String tenantId = info.getTenantId();
        int priority = info.getPriority();
        Integer current = priorityIndex.get(tenantId);

        if (current != null && current == priority) {
            groups.get(current).replace(info);
            return;
        }
        if (current != null) {
            detach(tenantId, current);
        }
        groups.computeIfAbsent(priority, p -> new PriorityGroup()).append(info);
        priorityIndex.put(tenantId, priority);
    }

    /**
     * 테넌트 제거.
     *
     * @param tenantId 테넌트 ID
     * @return 제거되었으면 true
     */
    public synchronized boolean removeTenant(String tenantId) {
        Integer current = priorityIndex.remove(tenantId);
        if (current == null) {
            return false;
        }
        detach(tenantId, current);
        return true;
    }

    public synchronized boolean contains(String tenantId) {
        return priorityIndex.containsKey(tenantId);
    }

    public synchronized int size() {
        return priorityIndex.size();
    }

    /**
     * 다음 실행할 테넌트 선택.
     *
     * @return 선택된 테넌트 (등록된 테넌트가 없으면 empty)
     */
    public synchronized Optional<TenantInfo> schedule() {
        if (groups.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(groups.firstEntry().getValue().next());
    }

    /**
     * 실행 가능한 테넌트 중 다음 테넌트 선택.
     *
     * <p>상위 그룹의 모든 테넌트가 실행 불가능할 때만 하위 그룹으로 내려갑니다.
     * 그룹 안의 회전 순서는 유지되며, 건너뛴 테넌트는 커서를 소모하지 않습니다.</p>
     *
     * <p>조건은 lock 안에서 평가되므로 blocking 없이 빠르게 반환해야 합니다.</p>
     *
     * @param eligible 실행할 작업이 있는 테넌트인지 판단하는 조건
     * @return 선택된 테넌트 (조건을 만족하는 테넌트가 없으면 empty)
     * @throws IllegalArgumentException eligible이 null인 경우
     */
    public synchronized Optional<TenantInfo> schedule(Predicate<TenantInfo> eligible) {
        if (eligible == null) {
            throw new IllegalArgumentException("eligible cannot be null");
        }
        for (PriorityGroup group : groups.values()) {
            Optional<TenantInfo> picked = group.nextMatching(eligible);
            if (picked.isPresent()) {
                return picked;
            }
        }
        return Optional.empty();
    }

    private void detach(String tenantId, int priority) {
        PriorityGroup group = groups.get(priority);
        if (group != null) {
            group.remove(tenantId);
            if (group.isEmpty()) {
                groups.remove(priority);
            }
        }
    }

    /**
     * 같은 우선순위의 테넌트 목록과 회전 커서.
     */
    private static final class PriorityGroup {

        private final List<TenantInfo> members = new ArrayList<>();
        private int cursor;

        void append(TenantInfo info) {
            members.add(info);
        }

        void replace(TenantInfo info) {
            int index = indexOf(info.getTenantId());
            if (index >= 0) {
                members.set(index, info);
            }
        }

        void remove(String tenantId) {
            int index = indexOf(tenantId);
            if (index < 0) {
                return;
            }
            members.remove(index);
            if (index < cursor) {
                cursor--;
            }
            if (cursor >= members.size()) {
                cursor = 0;
            }
        }

        boolean isEmpty() {
            return members.isEmpty();
        }

        TenantInfo next() {
            TenantInfo picked = members.get(cursor);
            cursor = (cursor + 1) % members.size();
            return picked;
        }

        Optional<TenantInfo> nextMatching(Predicate<TenantInfo> eligible) {
            int size = members.size();
            for (int offset = 0; offset < size; offset++) {
                int index = (cursor + offset) % size;
                TenantInfo candidate = members.get(index);
                if (eligible.test(candidate)) {
                    cursor = (index + 1) % size;
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        }

        private int indexOf(String tenantId) {
            for (int i = 0; i < members.size(); i++) {
                if (members.get(i).getTenantId().equals(tenantId)) {
                    return i;
                }
            }
            return -1;
        }
    }
}
