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
package net.boyechko.boxtree.box;

import net.boyechko.boxtree.document.DocumentContext;
import net.boyechko.boxtree.document.Element;
import net.boyechko.boxtree.image.ImageSurface;
import net.boyechko.boxtree.style.ComputedStyle;

/** A list marker drawn from {@code list-style-image}. */
public final class ImageMarkerBox extends Box {
    private final ImageSurface image;

    public ImageMarkerBox(
            DocumentContext document, Element element, ComputedStyle style, ImageSurface image) {
        super(document, element, style);
        if (image == null) {
            throw new IllegalArgumentException("Image markers need a resolved image");
        }
        this.image = image;
    }

    @Override
    public BoxKind kind() {
        return BoxKind.IMAGE_MARKER;
    }

    public ImageSurface image() {
        return image;
    }

    @Override
    public ImageMarkerBox copy() {
        return new ImageMarkerBox(document(), element(), style(), image);
    }
}
