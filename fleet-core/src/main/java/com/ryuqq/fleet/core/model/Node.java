package com.ryuqq.fleet.core.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 관리 대상 엔드포인트.
 *
 * <p>최초 체크인 시 생성되고, 모든 체크인마다 lastSeen이 갱신됩니다.
 * online 값은 Liveness Monitor가 lastSeen 경과 시간으로부터 도출하며,
 * 오프라인 노드도 유효한 디스패치 대상으로 남습니다.</p>
 *
 * <p><strong>attributes:</strong> 동적 그룹 조건식이 평가하는 인벤토리 속성
 * (os_name, os_version, os_build, hostname, agent_version, domain, is_domain_joined 등).
 * 키는 소문자로 정규화됩니다.</p>
 *
 * <p><strong>version:</strong> 저장소의 조건부 갱신(compare-and-set)에 사용되는 낙관적 잠금 버전.</p>
 *
 * @param nodeId 안정적인 노드 식별자
 * @param hostname 호스트명
 * @param attributes 인벤토리 속성 (불변 복사본)
 * @param tags 태그 집합 (소문자, 불변 복사본)
 * @param firstSeen 최초 체크인 시각
 * @param lastSeen 마지막 체크인 시각
 * @param online 온라인 여부
 * @param consecutiveFailures 연속 미응답 횟수
 * @param version 낙관적 잠금 버전
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Node(
    NodeId nodeId,
    String hostname,
    Map<String, String> attributes,
    Set<String> tags,
    Instant firstSeen,
    Instant lastSeen,
    boolean online,
    int consecutiveFailures,
    long version
) {

    public Node {
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname cannot be null or blank");
        }
        if (firstSeen == null || lastSeen == null) {
            throw new IllegalArgumentException("firstSeen and lastSeen cannot be null");
        }
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException(
                "consecutiveFailures must be non-negative (current: " + consecutiveFailures + ")"
            );
        }
        attributes = normalizeAttributes(attributes);
        tags = normalizeTags(tags);
    }

    /**
     * 최초 체크인으로 노드 생성.
     *
     * @param nodeId 노드 ID
     * @param hostname 호스트명
     * @param attributes 인벤토리 속성 (null 허용)
     * @param now 체크인 시각
     * @return 온라인 상태의 새 Node (version 0)
     */
    public static Node register(NodeId nodeId, String hostname, Map<String, String> attributes, Instant now) {
        return new Node(nodeId, hostname, attributes, Set.of(), now, now, true, 0, 0);
    }

    /**
     * 체크인 반영: lastSeen 갱신, 온라인 전환, 실패 카운터 초기화.
     *
     * @param hostname 보고된 호스트명 (null이면 기존 값 유지)
     * @param reported 보고된 속성 (null이면 기존 값 유지, 아니면 병합)
     * @param now 체크인 시각
     * @return 갱신된 Node
     */
    public Node checkIn(String hostname, Map<String, String> reported, Instant now) {
        Map<String, String> merged = new TreeMap<>(attributes);
        if (reported != null) {
            merged.putAll(normalizeAttributes(reported));
        }
        String nextHostname = hostname == null || hostname.isBlank() ? this.hostname : hostname;
        return new Node(nodeId, nextHostname, merged, tags, firstSeen, now, true, 0, version);
    }

    /**
     * 미응답 주기 하나를 반영: 실패 카운터 증가, 오프라인 전환.
     *
     * @return 갱신된 Node
     */
    public Node missedCheckIn() {
        return new Node(nodeId, hostname, attributes, tags, firstSeen, lastSeen, false, consecutiveFailures + 1, version);
    }

    /**
     * 태그 교체.
     *
     * @param newTags 새 태그 집합
     * @return 갱신된 Node
     */
    public Node withTags(Set<String> newTags) {
        return new Node(nodeId, hostname, attributes, newTags, firstSeen, lastSeen, online, consecutiveFailures, version);
    }

    /**
     * 저장소가 조건부 갱신 성공 시 부여하는 버전으로 교체.
     *
     * @param newVersion 새 버전
     * @return 갱신된 Node
     */
    public Node withVersion(long newVersion) {
        return new Node(nodeId, hostname, attributes, tags, firstSeen, lastSeen, online, consecutiveFailures, newVersion);
    }

    /**
     * 태그 보유 여부 (대소문자 무시).
     *
     * @param tagName 태그 이름
     * @return 보유 시 true
     */
    public boolean hasTag(String tagName) {
        return tagName != null && tags.contains(tagName.toLowerCase(Locale.ROOT));
    }

    /**
     * 조건식 평가용 속성 조회. "hostname"은 속성에 없으면 hostname 필드로 대체됩니다.
     *
     * @param field 속성 이름 (대소문자 무시)
     * @return 속성 값, 없으면 null
     */
    public String attribute(String field) {
        if (field == null) {
            return null;
        }
        String key = field.toLowerCase(Locale.ROOT);
        String value = attributes.get(key);
        if (value == null && "hostname".equals(key)) {
            return hostname;
        }
        return value;
    }

    private static Map<String, String> normalizeAttributes(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, String> normalized = new TreeMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                normalized.put(key.toLowerCase(Locale.ROOT), value);
            }
        });
        return Map.copyOf(normalized);
    }

    private static Set<String> normalizeTags(Set<String> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new TreeSet<>();
        for (String tag : source) {
            if (tag != null && !tag.isBlank()) {
                normalized.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(normalized);
    }
}
