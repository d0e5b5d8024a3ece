package com.linkpatrol.core.util;

import com.linkpatrol.core.model.LinkCheckConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * linkcheck.yml을 읽어 LinkCheckConfig로 변환.
 *
 * 예상 YAML 키:
 * timeoutSeconds: 10        # 또는 timeoutMs: 10000 (둘 다 있으면 timeoutMs 우선)
 * concurrency: 5            # 1..5
 * politenessDelayMs: 100
 * userAgent: "Mozilla/5.0 ..."
 * maxUrls: 100
 * output:
 *   dir: "out"
 * urls:
 *   - https://example.com/
 *   - https://example.com/about
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "linkcheck.yml";

    private YamlConfigLoader() {}

    public static LinkCheckConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static LinkCheckConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            LinkCheckConfig cfg = LinkCheckConfig.defaults();

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                cfg.validate();
                return cfg;
            }

            setLong(map, "timeoutSeconds", cfg::setTimeoutSeconds);
            setLong(map, "timeoutMs", cfg::setTimeoutMs);
            setInt(map, "concurrency", cfg::setConcurrency);
            setLong(map, "politenessDelayMs", ms -> cfg.setPolitenessDelay(Duration.ofMillis(ms)));
            setString(map, "userAgent", cfg::setUserAgent);
            setInt(map, "maxUrls", cfg::setMaxUrls);
            setStringList(map, "urls", cfg::setUrls);

            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            }

            cfg.validate();
            return cfg;
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // 여러 줄 문자열 지원
            for (String line : String.valueOf(v).split("\\R")) out.add(line.trim());
        }
        out.removeIf(String::isEmpty);
        setter.accept(List.copyOf(out));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(v instanceof Number n ? n.intValue() : Integer.parseInt(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(v instanceof Number n ? n.longValue() : Long.parseLong(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }
}
