package com.tessera.database.migration;

import com.tessera.database.exception.ConfigurationException;
import com.tessera.database.exception.MigrationException;
import com.tessera.database.schema.Schema;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptException;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.util.StreamUtils;

/**
 * Migrations read from {@code <name>.up.sql} / {@code <name>.down.sql} file pairs.
 *
 * <p>{@code location} is a Spring resource location: {@code classpath:db/migrations}, {@code
 * file:/srv/migrations}, or a bare filesystem path. Each file may hold several statements separated
 * by {@code ;}; separators inside quoted literals, dollar-quoted bodies and comments are ignored. A
 * missing down file is only an error when the migration is rolled back.
 */
public class SqlDirectoryMigrationSource implements MigrationSource {

    static final String UP_SUFFIX = ".up.sql";
    static final String DOWN_SUFFIX = ".down.sql";

    // $$...$$, $tag$...$tag$ and `identifier`
    private static final Pattern PROTECTED_SEGMENT =
            Pattern.compile("\\$((?:[A-Za-z_]\\w*)?)\\$.*?\\$\\1\\$|`[^`\\r\\n]*`", Pattern.DOTALL);
    private static final String PLACEHOLDER_START = "\uE000";
    private static final String PLACEHOLDER_END = "\uE001";
    private static final Pattern PLACEHOLDER = Pattern.compile("\uE000(\\d+)\uE001");

    private final String location;
    private final ResourcePatternResolver resolver;

    public SqlDirectoryMigrationSource(String location) {
        this(location, new PathMatchingResourcePatternResolver());
    }

    public SqlDirectoryMigrationSource(String location, ResourcePatternResolver resolver) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location must not be null or blank");
        }
        this.location = location.contains(":") ? location : "file:" + location;
        this.resolver = resolver;
    }

    @Override
    public List<Migration> migrations() {
        Map<String, Migration> migrations = new TreeMap<>();
        for (Resource up : resources()) {
            String filename = up.getFilename();
            String name = MigrationRegistry.validateName(filename.substring(0, filename.length() - UP_SUFFIX.length()));
            if (migrations.put(name, new SqlMigration(name, up)) != null) {
                throw new ConfigurationException(
                        "Duplicate migration name '%s'".formatted(name), Map.of("migration", name));
            }
        }
        return new ArrayList<>(migrations.values());
    }

    private Resource[] resources() {
        String base = location.endsWith("/") ? location : location + "/";
        try {
            return resolver.getResources(base + "*" + UP_SUFFIX);
        } catch (IOException e) {
            throw new ConfigurationException(
                    "Cannot list migrations at '%s': %s".formatted(location, e.getMessage()),
                    Map.of("location", location));
        }
    }

    /**
     * Splits a script on {@code ;} with Spring's {@link ScriptUtils}. Dollar-quoted bodies and
     * backtick identifiers are set aside first, since the splitter only knows {@code '} and {@code "}
     * quoting. Blank statements are dropped.
     */
    static List<String> splitStatements(String script) {
        List<String> protectedSegments = new ArrayList<>();
        Matcher matcher = PROTECTED_SEGMENT.matcher(script);
        StringBuilder masked = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(masked, Matcher.quoteReplacement(
                    PLACEHOLDER_START + protectedSegments.size() + PLACEHOLDER_END));
            protectedSegments.add(matcher.group());
        }
        matcher.appendTail(masked);

        List<String> parts = new ArrayList<>();
        ScriptUtils.splitSqlScript(
                null,
                masked.toString(),
                ScriptUtils.DEFAULT_STATEMENT_SEPARATOR,
                ScriptUtils.DEFAULT_COMMENT_PREFIXES,
                ScriptUtils.DEFAULT_BLOCK_COMMENT_START_DELIMITER,
                ScriptUtils.DEFAULT_BLOCK_COMMENT_END_DELIMITER,
                parts);

        List<String> statements = new ArrayList<>();
        for (String part : parts) {
            String statement = restore(part, protectedSegments).trim();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }

    private static String restore(String statement, List<String> protectedSegments) {
        Matcher matcher = PLACEHOLDER.matcher(statement);
        StringBuilder restored = new StringBuilder();
        while (matcher.find()) {
            String segment = protectedSegments.get(Integer.parseInt(matcher.group(1)));
            matcher.appendReplacement(restored, Matcher.quoteReplacement(segment));
        }
        matcher.appendTail(restored);
        return restored.toString();
    }

    private static String read(String migration, String operation, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MigrationException(migration, operation, "cannot read " + resource.getDescription(), e);
        }
    }

    public String location() {
        return location;
    }

    private static final class SqlMigration implements Migration {

        private final String name;
        private final Resource up;

        SqlMigration(String name, Resource up) {
            this.name = name;
            this.up = up;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void up(Schema schema) {
            run(schema, "up", up);
        }

        @Override
        public void down(Schema schema) {
            Resource down;
            try {
                down = up.createRelative(name + DOWN_SUFFIX);
            } catch (IOException e) {
                throw new MigrationException(name, "down", "cannot resolve down script", e);
            }
            if (!down.exists()) {
                throw new MigrationException(name, "down", "no " + name + DOWN_SUFFIX + " next to the up script");
            }
            run(schema, "down", down);
        }

        private void run(Schema schema, String operation, Resource script) {
            List<String> statements;
            try {
                statements = splitStatements(read(name, operation, script));
            } catch (ScriptException e) {
                throw new MigrationException(name, operation, e.getMessage(), e);
            }
            for (String statement : statements) {
                schema.adapter().raw(statement, List.of());
            }
        }
    }
}
