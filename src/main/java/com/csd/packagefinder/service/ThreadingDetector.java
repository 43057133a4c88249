package com.csd.packagefinder.service;

import com.csd.packagefinder.model.ThreadingSupport;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword scan of free text (summary, readme, formula comments) for signs of multi-threading.
 * Returns UNKNOWN when there is no text at all, so "no" stays distinct from "could not tell".
 */
public final class ThreadingDetector {

    /** Command-line flags that usually set a thread or core count. */
    static final Set<String> THREAD_FLAGS = Set.of(
            "-t", "--threads", "-threads", "--thread", "-thread",
            "--nthreads", "-nthreads", "--num-threads", "-n",
            "--cores", "-cores", "--num-cores");

    /** Too common on their own; only counted when followed by a number. */
    static final Set<String> SHORT_FLAGS = Set.of("-t", "-n");

    static final List<String> PARALLEL_KEYWORDS = List.of(
            "parallel", "multithread", "multi-thread", "multi thread",
            "concurrent", "cpu cores", "processor cores");

    private static final Pattern FLAG = Pattern.compile("(?<![\\w-])(--?[a-z][a-z-]*)(?![a-z-])(\\s*=?\\s*\\d+)?");

    private ThreadingDetector() {}

    public static Assessment detect(String... texts) {
        StringBuilder sb = new StringBuilder();
        for (String text : texts) {
            if (text != null && !text.isBlank()) {
                sb.append(text.toLowerCase(Locale.ROOT)).append(' ');
            }
        }
        if (sb.length() == 0) {
            return new Assessment(ThreadingSupport.UNKNOWN, List.of());
        }
        String haystack = sb.toString();

        Set<String> flags = new LinkedHashSet<>();
        Matcher m = FLAG.matcher(haystack);
        while (m.find()) {
            String flag = m.group(1);
            if (!THREAD_FLAGS.contains(flag)) continue;
            if (SHORT_FLAGS.contains(flag) && m.group(2) == null) continue;
            flags.add(flag);
        }

        boolean keyword = PARALLEL_KEYWORDS.stream().anyMatch(haystack::contains);
        ThreadingSupport support = keyword || !flags.isEmpty() ? ThreadingSupport.EXPLICIT : ThreadingSupport.NONE_DETECTED;
        return new Assessment(support, List.copyOf(flags));
    }

    @Value
    public static class Assessment {
        ThreadingSupport support;
        List<String> flags;
    }
}
