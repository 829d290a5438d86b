package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.exception.DuplicateKindException;
import com.ryuqq.chariot.core.model.Kind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Kind → {@link ComponentRecord} 매핑.
 *
 * <p>컨테이너 인스턴스가 독점 소유하며, 초기화 단계에서만 구조가 변경됩니다.
 * 이후에는 해석 중 값 채우기와 ambient 토큰 교체를 제외하면 읽기 전용입니다.</p>
 *
 * <p><strong>순회 순서:</strong> 등록 순서 (선언 순서)</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class Registry {

    private final Map<Kind<?>, ComponentRecord> records = new LinkedHashMap<>();

    /**
     * 이미 해석된 값 등록.
     *
     * @param kind Kind
     * @param value 값
     * @param <T> 컴포넌트 타입
     * @throws DuplicateKindException kind가 이미 등록된 경우
     * @throws IllegalArgumentException value가 kind를 만족하지 않는 경우
     */
    public <T> void registerResolved(Kind<T> kind, T value) {
        if (!kind.accepts(value)) {
            throw new IllegalArgumentException("value must be a non-null instance of " + kind);
        }
        register(ComponentRecord.resolved(kind, value));
    }

    /**
     * 해석된 값을 교체 (ambient 토큰 리셋 전용).
     *
     * @param kind Kind
     * @param value 새 값
     * @param <T> 컴포넌트 타입
     * @throws IllegalArgumentException kind가 등록되지 않았거나 값이 kind를 만족하지 않는 경우
     */
    public <T> void replaceResolved(Kind<T> kind, T value) {
        ComponentRecord record = records.get(kind);
        if (record == null) {
            throw new IllegalArgumentException(kind + " is not registered");
        }
        if (!kind.accepts(value)) {
            throw new IllegalArgumentException("value must be a non-null instance of " + kind);
        }
        record.resolve(value);
    }

    void register(ComponentRecord record) {
        ComponentRecord existing = records.get(record.getKind());
        if (existing != null) {
            throw new DuplicateKindException(record.getKind(), existing.getProducerName(), record.getProducerName());
        }
        records.put(record.getKind(), record);
    }

    /**
     * Kind로 레코드 조회.
     *
     * @param kind Kind
     * @return 레코드, 없으면 empty
     */
    public Optional<ComponentRecord> find(Kind<?> kind) {
        return Optional.ofNullable(records.get(kind));
    }

    /**
     * 해석된 값 조회. 해석을 유발하지 않습니다.
     *
     * @param kind Kind
     * @param <T> 컴포넌트 타입
     * @return 해석된 값, 등록되지 않았거나 아직 해석되지 않았으면 empty
     */
    public <T> Optional<T> valueOf(Kind<T> kind) {
        ComponentRecord record = records.get(kind);
        if (record == null || !record.isResolved()) {
            return Optional.empty();
        }
        return Optional.of(kind.cast(record.getValue()));
    }

    public boolean contains(Kind<?> kind) {
        return records.containsKey(kind);
    }

    /**
     * 등록 순서의 모든 레코드.
     *
     * @return 레코드 목록 (읽기 전용 스냅샷)
     */
    public List<ComponentRecord> records() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    /**
     * 등록 순서의 모든 Kind.
     *
     * @return Kind 목록 (읽기 전용 스냅샷)
     */
    public List<Kind<?>> kinds() {
        return List.copyOf(records.keySet());
    }

    public int size() {
        return records.size();
    }
}
