package org.netpreserve.archivescope.analysis;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.archivescope.config.AppConfig;
import org.netpreserve.archivescope.fetch.FetchedPage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects technologies from response headers, the {@code <meta name="generator">} tag and
 * fingerprints in the page source. The built-in rule table is {@code technologies.yaml}.
 */
public class RuleBasedTechnologyDetector implements TechnologyDetector {
    private static final Pattern META_TAG = Pattern.compile("(?is)<meta\\b[^>]*>");
    private static final Pattern NAME_GENERATOR = Pattern.compile("(?i)\\bname\\s*=\\s*[\"']?generator\\b");
    private static final Pattern CONTENT_ATTR = Pattern.compile("(?i)\\bcontent\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+))");
    private final List<CompiledRule> rules;

    /**
     * One entry of the rule table.
     *
     * @param name      technology name
     * @param category  category the technology is counted under
     * @param headers   lower-cased header name to a regex its value must contain, "" for presence
     * @param generator substrings of the generator meta tag
     * @param patterns  case-insensitive regexes over the page source
     */
    public record Rule(String name, String category, @Nullable Map<String, String> headers,
                       @Nullable List<String> generator, @Nullable List<String> patterns) {
    }

    private record CompiledRule(Technology technology, Map<String, Pattern> headers, List<String> generator,
                                List<Pattern> patterns) {
    }

    public RuleBasedTechnologyDetector(List<Rule> rules) {
        var compiled = new ArrayList<CompiledRule>();
        for (Rule rule : rules) {
            var headers = new LinkedHashMap<String, Pattern>();
            if (rule.headers() != null) {
                rule.headers().forEach((name, regex) -> headers.put(name.toLowerCase(Locale.ROOT),
                        regex == null || regex.isEmpty() ? null : Pattern.compile(regex, Pattern.CASE_INSENSITIVE)));
            }
            var generator = rule.generator() == null ? List.<String>of() : rule.generator().stream()
                    .map(s -> s.toLowerCase(Locale.ROOT)).toList();
            var patterns = rule.patterns() == null ? List.<Pattern>of() : rule.patterns().stream()
                    .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE)).toList();
            compiled.add(new CompiledRule(new Technology(rule.name(), rule.category()), headers, generator,
                    patterns));
        }
        this.rules = List.copyOf(compiled);
    }

    /**
     * Loads the built-in rule table.
     */
    public static RuleBasedTechnologyDetector withBuiltInRules() {
        try (InputStream stream = Objects.requireNonNull(
                RuleBasedTechnologyDetector.class.getResourceAsStream("technologies.yaml"),
                "missing technologies.yaml")) {
            List<Rule> rules = AppConfig.yamlMapper().readValue(stream, new TypeReference<>() {
            });
            return new RuleBasedTechnologyDetector(rules);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load technology rules", e);
        }
    }

    @Override
    public List<Technology> detect(FetchedPage page) {
        String generator = generator(page.body());
        var detected = new ArrayList<Technology>();
        for (CompiledRule rule : rules) {
            if (matchesHeaders(rule, page) || matchesGenerator(rule, generator) || matchesBody(rule, page.body())) {
                detected.add(rule.technology());
            }
        }
        return detected;
    }

    private static boolean matchesHeaders(CompiledRule rule, FetchedPage page) {
        for (var entry : rule.headers().entrySet()) {
            String value = page.header(entry.getKey());
            if (value == null) continue;
            if (entry.getValue() == null || entry.getValue().matcher(value).find()) return true;
        }
        return false;
    }

    private static boolean matchesGenerator(CompiledRule rule, @Nullable String generator) {
        if (generator == null) return false;
        for (String expected : rule.generator()) {
            if (generator.contains(expected)) return true;
        }
        return false;
    }

    private static boolean matchesBody(CompiledRule rule, String body) {
        for (Pattern pattern : rule.patterns()) {
            if (pattern.matcher(body).find()) return true;
        }
        return false;
    }

    /**
     * Lower-cased content of the first generator meta tag.
     */
    static @Nullable String generator(String html) {
        Matcher tags = META_TAG.matcher(html);
        while (tags.find()) {
            String tag = tags.group();
            if (!NAME_GENERATOR.matcher(tag).find()) continue;
            Matcher content = CONTENT_ATTR.matcher(tag);
            if (!content.find()) continue;
            for (int group = 1; group <= 3; group++) {
                if (content.group(group) != null) return content.group(group).toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }
}
