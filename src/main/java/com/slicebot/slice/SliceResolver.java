package com.slicebot.slice;

import com.slicebot.model.SliceConstraint;
import com.slicebot.model.TimeBounds;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 模块说明：SliceResolver（class）。
 * 主要职责：把切片 DSL 规范化为（时间范围、切片族、查询签名、模式）四元组。
 * 使用建议：签名只由非时间约束和图元数据决定，修改 QuerySignatureCalculator 会使既有缓存全部失配。
 */
public final class SliceResolver {
    private final SliceConstraintParser parser;
    private final QuerySignatureCalculator signatures;

    public SliceResolver() {
        this(new SliceConstraintParser(), new QuerySignatureCalculator());
    }

    public SliceResolver(SliceConstraintParser parser, QuerySignatureCalculator signatures) {
        this.parser = parser;
        this.signatures = signatures;
    }

    public SliceConstraint parse(String dsl, LocalDate referenceDate) {
        return parser.parse(dsl, referenceDate);
    }

    public ResolvedSlice resolve(String dsl, QueryShape shape, LocalDate referenceDate) {
        SliceConstraint constraint = parser.parse(dsl, referenceDate);
        return resolve(dsl, constraint, shape, constraint.bounds);
    }

    /**
     * Resolve with an explicit window, which takes precedence over any time clause in the DSL.
     */
    public ResolvedSlice resolve(String dsl, SliceConstraint constraint, QueryShape shape, TimeBounds window) {
        TimeBounds bounds = window != null ? window : constraint.bounds;
        SliceConstraint effective = Objects.equals(bounds, constraint.bounds) ? constraint : constraint.withBounds(bounds);
        return new ResolvedSlice(
                dsl == null ? "" : dsl.trim(),
                effective,
                bounds,
                effective.sliceFamily(),
                signatures.compute(effective, shape),
                effective.mode
        );
    }

    public String signatureFor(SliceConstraint constraint, QueryShape shape) {
        return signatures.compute(constraint, shape);
    }

    /**
     * Slice family of a stored record's DSL. Records written by older runs may carry malformed text;
     * those map to a family no request will ever produce.
     */
    public String familyOf(String sliceDsl) {
        try {
            return parser.parse(sliceDsl, LocalDate.of(2000, 1, 1)).sliceFamily();
        } catch (IllegalArgumentException e) {
            return "#unparseable:" + (sliceDsl == null ? "" : sliceDsl.trim());
        }
    }
}
