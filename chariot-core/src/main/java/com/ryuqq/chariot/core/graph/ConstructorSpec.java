package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.model.Initializer;

/**
 * 1개 이상의 Kind를 생성하는 initializer.
 *
 * <p>여러 Kind를 생성하는 경우 하나의 ConstructorSpec을 여러 {@link ComponentRecord}가 공유합니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
final class ConstructorSpec extends Declaration {

    ConstructorSpec(Initializer initializer) {
        super(initializer);
    }
}
