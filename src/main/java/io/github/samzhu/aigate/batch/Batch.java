package io.github.samzhu.aigate.batch;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import io.github.samzhu.aigate.exception.GatewayException;

/**
 * 單次呼叫的有序請求項目集合
 *
 * <p>建立時即驗證：
 * <ul>
 *   <li>項目數不超過上限</li>
 *   <li>每個項目的 id 與標籤不可空白</li>
 *   <li>id 在批次內唯一</li>
 *   <li>每個附件（若有）的內容不可為空</li>
 * </ul>
 * 違反任一條件拋出 {@code INVALID_ARGUMENT}，因此任何供應商呼叫之前就會失敗。
 * 空批次是合法的。
 */
public final class Batch {

    private static final Batch EMPTY = new Batch(List.of());

    private final List<RequestItem> items;

    private Batch(List<RequestItem> items) {
        this.items = items;
    }

    public static Batch empty() {
        return EMPTY;
    }

    public static Batch of(List<RequestItem> items) {
        return of(items, Integer.MAX_VALUE);
    }

    /**
     * 驗證並建立批次
     *
     * @param items 依呼叫端順序排列的項目
     * @param maxItems 項目數上限
     * @throws GatewayException {@code INVALID_ARGUMENT}，批次格式錯誤時
     */
    public static Batch of(List<RequestItem> items, int maxItems) {
        if (items == null) {
            throw GatewayException.invalidArgument("Batch items must not be null");
        }
        if (items.size() > maxItems) {
            throw GatewayException.invalidArgument(
                "Batch contains " + items.size() + " items, the maximum is " + maxItems);
        }
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < items.size(); i++) {
            RequestItem item = items.get(i);
            if (item == null) {
                throw GatewayException.invalidArgument("Item at index " + i + " is null");
            }
            if (StringUtils.isBlank(item.id())) {
                throw GatewayException.invalidArgument("Item at index " + i + " has a blank id");
            }
            if (StringUtils.isBlank(item.label())) {
                throw GatewayException.invalidArgument("Item '" + item.id() + "' has a blank label");
            }
            for (int j = 0; j < item.media().size(); j++) {
                if (item.media().get(j).isEmpty()) {
                    throw GatewayException.invalidArgument(
                        "Item '" + item.id() + "' has empty media content at attachment " + (j + 1));
                }
            }
            if (!seenIds.add(item.id())) {
                throw GatewayException.invalidArgument("Duplicate item id '" + item.id() + "'");
            }
        }
        return items.isEmpty() ? EMPTY : new Batch(List.copyOf(items));
    }

    public List<RequestItem> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public String toString() {
        return "Batch{size=" + items.size() + '}';
    }
}
