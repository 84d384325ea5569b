package com.notegraph.core.service.graph.extract;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracts {@code [[wiki links]]} and {@code #hashtags} from markdown.
 */
public class MarkdownContentExtractor implements ContentExtractor {

    private static final Pattern WIKI_LINK = Pattern.compile("\\[\\[([^\\]]+)\\]\\]");
    private static final Pattern HASHTAG = Pattern.compile("(^|\\s)#([\\p{L}0-9_\\-/]+)");

    @Override
    public List<String> extractWikiLinks(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        var links = new ArrayList<String>();
        var matcher = WIKI_LINK.matcher(text);
        while (matcher.find()) {
            var target = stripAlias(matcher.group(1)).trim();
            if (!target.isEmpty()) {
                links.add(target);
            }
        }
        return links;
    }

    @Override
    public List<String> extractTags(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        var tags = new LinkedHashSet<String>();
        var matcher = HASHTAG.matcher(text);
        while (matcher.find()) {
            tags.add(matcher.group(2));
        }
        return List.copyOf(tags);
    }

    // [[target|alias]] -> target
    private static String stripAlias(String raw) {
        int pipe = raw.indexOf('|');
        return pipe >= 0 ? raw.substring(0, pipe) : raw;
    }
}
