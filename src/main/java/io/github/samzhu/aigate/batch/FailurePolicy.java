package io.github.samzhu.aigate.batch;

/**
 * 端點對項目失敗的處理策略
 *
 * <ul>
 *   <li>{@code PARTIAL} - 失敗項目以錯誤標記回傳，其他項目照常回傳</li>
 *   <li>{@code ALL_OR_NOTHING} - 任一項目失敗即升級為呼叫層級錯誤（以輸入順序的第一個失敗為準）</li>
 * </ul>
 */
public enum FailurePolicy {
    PARTIAL,
    ALL_OR_NOTHING
}
