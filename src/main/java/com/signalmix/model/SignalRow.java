package com.signalmix.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 模块说明：SignalRow（class）。
 * 主要职责：两类信号源（swing 模型 / microcap 扫描）统一后的规范行。
 * 使用建议：ticker 为空的行保留在报表中，但不参与任何 enrichment 匹配。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class SignalRow {
    public static final String GROUP_SWING = "Daily Swing (Large/Mid)";
    public static final String GROUP_MICROCAP = "Intraday Spikes (Microcap)";

    String group;
    String ticker;
    String label;
    Double probPct;
    Double expMovePct;
    String side;
    Double entry;
    Double tp;
    Double sl;
    String headline;
    String source;
    @Builder.Default
    Map<String, String> extras = Map.of();

    public boolean isJoinable() {
        return ticker != null && !ticker.isEmpty();
    }
}
