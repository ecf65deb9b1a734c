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
package net.boyechko.boxtree.image;

import com.itextpdf.io.image.ImageData;
import com.itextpdf.io.image.ImageDataFactory;
import java.net.MalformedURLException;
import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves images with iText's image decoders (PNG, JPEG, GIF, BMP, TIFF, JBIG2). Missing,
 * unreadable and corrupt images all resolve to empty.
 */
public class ITextImageResolver implements ImageResolver {
    private static final Logger logger = LoggerFactory.getLogger(ITextImageResolver.class);

    private static final Set<String> DEFAULT_SCHEMES = Set.of("file", "jar", "http", "https");

    private final Set<String> allowedSchemes;

    public ITextImageResolver() {
        this(DEFAULT_SCHEMES);
    }

    /** @param allowedSchemes URI schemes this resolver may open; anything else resolves to empty */
    public ITextImageResolver(Set<String> allowedSchemes) {
        this.allowedSchemes = Set.copyOf(allowedSchemes);
    }

    @Override
    public Optional<ImageSurface> resolve(URI uri) {
        if (uri == null || uri.getScheme() == null) {
            logger.debug("Cannot resolve image without an absolute URI: {}", uri);
            return Optional.empty();
        }
        if (!allowedSchemes.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            logger.debug("Image scheme '{}' not allowed: {}", uri.getScheme(), uri);
            return Optional.empty();
        }

        try {
            ImageData data = ImageDataFactory.create(uri.toURL());
            logger.debug(
                    "Loaded {} image {} ({}x{})",
                    data.getOriginalType(),
                    uri,
                    data.getWidth(),
                    data.getHeight());
            return Optional.of(new ITextImageSurface(uri, data));
        } catch (MalformedURLException | IllegalArgumentException e) {
            logger.debug("Invalid image URI {}: {}", uri, e.getMessage());
            return Optional.empty();
        } catch (com.itextpdf.io.exceptions.IOException e) {
            logger.debug("Failed to load image {}: {}", uri, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            // Decoders fail on corrupt data with whatever the format helper happens to throw.
            logger.debug("Corrupt image {}: {}", uri, e.toString());
            return Optional.empty();
        }
    }
}
