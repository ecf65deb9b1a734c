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
package net.boyechko.boxtree.document;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import net.boyechko.boxtree.build.ElementHandler;
import net.boyechko.boxtree.image.ImageResolver;
import net.boyechko.boxtree.image.ImageSurface;
import net.boyechko.boxtree.style.ComputedStyle;
import net.boyechko.boxtree.style.StyleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collaborators for a single box tree build: the source tree, where styles come from, how images
 * are fetched and which elements get special handling. Styles and images are cached per build.
 */
public class DocumentContext {
    private static final Logger logger = LoggerFactory.getLogger(DocumentContext.class);

    private final Element root;
    private final URI baseUri;
    private final StyleProvider styleProvider;
    private final ImageResolver imageResolver;
    private final ElementHandler elementHandler;

    private final Map<Element, ComputedStyle> styleCache = new HashMap<>();
    private final Map<URI, Optional<ImageSurface>> imageCache = new HashMap<>();

    public DocumentContext(
            Element root,
            URI baseUri,
            StyleProvider styleProvider,
            ImageResolver imageResolver,
            ElementHandler elementHandler) {
        if (root == null) {
            throw new IllegalArgumentException("Root element is required");
        }
        if (styleProvider == null) {
            throw new IllegalArgumentException("Style provider is required");
        }
        this.root = root;
        this.baseUri = baseUri;
        this.styleProvider = styleProvider;
        this.imageResolver = imageResolver != null ? imageResolver : ImageResolver.none();
        this.elementHandler = elementHandler != null ? elementHandler : ElementHandler.none();
    }

    /** Context with no base URI, no image support and no special element handling. */
    public static DocumentContext of(Element root, StyleProvider styleProvider) {
        return new DocumentContext(root, null, styleProvider, null, null);
    }

    public Element root() {
        return root;
    }

    public URI baseUri() {
        return baseUri;
    }

    public ImageResolver imageResolver() {
        return imageResolver;
    }

    public ElementHandler elementHandler() {
        return elementHandler;
    }

    public ComputedStyle styleFor(Element element) {
        return styleCache.computeIfAbsent(element, styleProvider::styleFor);
    }

    /**
     * Resolves an image reference (relative to the base URI, if any). Returns empty when the
     * reference is malformed or the resolver cannot load it.
     */
    public Optional<ImageSurface> resolveImage(String reference) {
        URI uri;
        try {
            uri = baseUri != null ? baseUri.resolve(reference) : URI.create(reference);
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring malformed image reference '{}': {}", reference, e.getMessage());
            return Optional.empty();
        }
        return imageCache.computeIfAbsent(uri, imageResolver::resolve);
    }
}
