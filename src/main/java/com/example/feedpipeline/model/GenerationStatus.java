package com.example.feedpipeline.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 生成记录状态机。
 * PENDING -> GENERATING -> GENERATED -> DELIVERING -> COMPLETED，
 * 任一非终态可进入 FAILED；COMPLETED / FAILED 为终态。
 */
public enum GenerationStatus {
    PENDING,
    GENERATING,
    GENERATED,
    DELIVERING,
    COMPLETED,
    FAILED;

    /**
     * 占用 feed 的状态（同一 feed 同时最多一条）。
     */
    public static final Set<GenerationStatus> IN_FLIGHT = EnumSet.of(PENDING, GENERATING, GENERATED, DELIVERING);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 判断是否允许迁移到目标状态。GENERATED -> COMPLETED 仅用于 DOWNLOAD，
     * 由 {@link GenerationRecord#markCompleted} 额外校验。
     *
     * @param target 目标状态
     * @return true 表示合法迁移
     */
    public boolean canTransitionTo(GenerationStatus target) {
        if (isTerminal()) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        switch (this) {
            case PENDING:
                return target == GENERATING;
            case GENERATING:
                return target == GENERATED;
            case GENERATED:
                return target == DELIVERING || target == COMPLETED;
            case DELIVERING:
                return target == COMPLETED;
            default:
                return false;
        }
    }
}
