package com.agentloom.core.memory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keyword-matching {@link MemoryService}: an entry matches when it shares at least one
 * word with the query, ignoring case.
 */
public class InMemoryMemoryService implements MemoryService {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<MemoryEntry>> entries = new ConcurrentHashMap<>();

    public void addEntry(String appName, String userId, MemoryEntry entry) {
        entries.computeIfAbsent(key(appName, userId), k -> new CopyOnWriteArrayList<>()).add(entry);
    }

    @Override
    public SearchMemoryResponse searchMemory(String appName, String userId, String query) {
        List<MemoryEntry> userEntries = entries.get(key(appName, userId));
        Set<String> queryWords = words(query);
        if (userEntries == null || queryWords.isEmpty()) {
            return SearchMemoryResponse.empty();
        }
        var matches = new ArrayList<MemoryEntry>();
        for (MemoryEntry entry : userEntries) {
            if (entry.content() == null) {
                continue;
            }
            Set<String> entryWords = words(entry.content().text());
            if (queryWords.stream().anyMatch(entryWords::contains)) {
                matches.add(entry);
            }
        }
        return new SearchMemoryResponse(matches);
    }

    private static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toSet());
    }

    private static String key(String appName, String userId) {
        return appName + "/" + userId;
    }
}
