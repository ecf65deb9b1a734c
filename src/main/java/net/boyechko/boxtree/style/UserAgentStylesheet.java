/*
 * CSS-BoxTree - Formatting structure construction for CSS 2.1 layout
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.boxtree.style;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Per-tag default declarations, the way a browser's built-in stylesheet gives {@code <p>} its
 * {@code display: block}. Loaded from YAML:
 *
 * <pre>
 * elements:
 *   p: {display: block}
 *   pre: {display: block, white-space: pre}
 * </pre>
 */
public final class UserAgentStylesheet {
    private static final String DEFAULT_STYLESHEET_RESOURCE = "/user-agent.yaml";
    private static final Logger logger = LoggerFactory.getLogger(UserAgentStylesheet.class);

    /** Tag name to declarations. Public for SnakeYAML bean loading. */
    public Map<String, Map<String, String>> elements;

    public UserAgentStylesheet() {
        this.elements = new HashMap<>();
    }

    public Map<String, Map<String, String>> getElements() {
        return elements;
    }

    /** Declarations for a tag name (case-insensitive), empty if the sheet has none. */
    public Map<String, String> declarationsFor(String tagName) {
        Map<String, String> decls = elements.get(tagName.toLowerCase(Locale.ROOT));
        return decls != null ? decls : Map.of();
    }

    /**
     * Load a stylesheet from a classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static UserAgentStylesheet fromResource(String resourcePath) {
        try (var inputStream = UserAgentStylesheet.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(UserAgentStylesheet.class, new LoaderOptions()));
            UserAgentStylesheet sheet = yaml.load(inputStream);
            if (sheet == null) {
                sheet = new UserAgentStylesheet();
            } else if (sheet.elements == null) {
                sheet.elements = new HashMap<>();
            }
            sheet.normalizeTagNames();

            logger.debug(
                    "Loaded user-agent stylesheet with {} elements from resource {}",
                    sheet.elements.size(),
                    resourcePath);

            var warnings = sheet.validateConsistency();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Stylesheet loaded from {} has {} consistency warnings:",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }

            return sheet;
        } catch (Exception e) {
            logger.error(
                    "Failed to load stylesheet from resource {}: {}", resourcePath, e.getMessage());
            throw new RuntimeException(
                    "Failed to load stylesheet from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load the default HTML stylesheet from its standard location. */
    public static UserAgentStylesheet loadDefault() {
        return fromResource(DEFAULT_STYLESHEET_RESOURCE);
    }

    /** Just enough for paragraphs, lists and emphasis. */
    public static UserAgentStylesheet minimal() {
        UserAgentStylesheet s = new UserAgentStylesheet();
        s.elements.put("html", Map.of("display", "block"));
        s.elements.put("body", Map.of("display", "block"));
        s.elements.put("p", Map.of("display", "block"));
        s.elements.put("div", Map.of("display", "block"));
        s.elements.put("ul", Map.of("display", "block"));
        s.elements.put("li", Map.of("display", "list-item"));
        s.elements.put("head", Map.of("display", "none"));
        return s;
    }

    private void normalizeTagNames() {
        Map<String, Map<String, String>> normalized = new HashMap<>();
        for (Map.Entry<String, Map<String, String>> entry : elements.entrySet()) {
            // Declaration order matters between a shorthand and its longhands.
            Map<String, String> decls = new LinkedHashMap<>();
            if (entry.getValue() != null) {
                for (Map.Entry<String, String> decl : entry.getValue().entrySet()) {
                    String property = String.valueOf(decl.getKey()).toLowerCase(Locale.ROOT);
                    decls.remove(property);
                    decls.put(property, String.valueOf(decl.getValue()));
                }
            }
            normalized.put(String.valueOf(entry.getKey()).toLowerCase(Locale.ROOT), decls);
        }
        elements = normalized;
    }

    /**
     * Checks every declaration in the sheet and returns a list of warnings: unknown properties and
     * values that would be rejected when styles are computed.
     *
     * @return List of warning messages (empty if the sheet is consistent)
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();

        for (Map.Entry<String, Map<String, String>> entry : elements.entrySet()) {
            String tag = entry.getKey();
            for (Map.Entry<String, String> decl : entry.getValue().entrySet()) {
                if (!isKnownProperty(decl.getKey())) {
                    warnings.add(
                            String.format(
                                    "Unknown property: <%s> declares '%s'", tag, decl.getKey()));
                    continue;
                }
                try {
                    Declarations.apply(
                            ComputedStyle.INITIAL,
                            null,
                            Map.of(decl.getKey(), decl.getValue()));
                } catch (IllegalArgumentException e) {
                    warnings.add(String.format("Invalid value: <%s> %s", tag, e.getMessage()));
                }
            }
        }

        return warnings;
    }

    private static boolean isKnownProperty(String property) {
        return switch (property) {
            case "display",
                    "white-space",
                    "list-style",
                    "list-style-type",
                    "list-style-position",
                    "list-style-image" -> true;
            default -> false;
        };
    }
}
