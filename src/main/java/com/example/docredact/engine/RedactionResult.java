package com.example.docredact.engine;

import com.example.docredact.model.PiiItem;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Getter
@AllArgsConstructor
public class RedactionResult {
    private final Path artifact;
    private final Map<String, List<PiiItem>> items;

    public boolean hasItems() {
        return items != null && items.values().stream().anyMatch(list -> !list.isEmpty());
    }

    public int itemCount() {
        return items == null ? 0 : items.values().stream().mapToInt(List::size).sum();
    }
}
