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
package net.boyechko.boxtree.build;

import java.util.Map;
import java.util.Optional;
import net.boyechko.boxtree.box.BlockBox;
import net.boyechko.boxtree.box.Box;
import net.boyechko.boxtree.box.ImageMarkerBox;
import net.boyechko.boxtree.box.TextBox;
import net.boyechko.boxtree.image.ImageSurface;
import net.boyechko.boxtree.style.ComputedStyle;
import net.boyechko.boxtree.style.ListStylePosition;
import net.boyechko.boxtree.style.ListStyleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Adds list markers to boxes of {@code display: list-item} elements. */
public class ListMarkerInserter {
    private static final Logger logger = LoggerFactory.getLogger(ListMarkerInserter.class);

    /** Marker glyph for each list-style-type; {@code none} has no glyph. */
    public static final Map<ListStyleType, String> GLYPHS =
            Map.of(
                    ListStyleType.DISC, "\u2022",
                    ListStyleType.CIRCLE, "\u25E6",
                    ListStyleType.SQUARE, "\u25AA");

    /** Follows an inside marker so the marker never touches the content. */
    static final String INSIDE_SPACER = "\u00A0";

    /**
     * Creates the marker for {@code box} and attaches it according to list-style-position. An
     * image marker is used when list-style-image resolves; otherwise the glyph for
     * list-style-type, or no marker at all for {@code none}.
     *
     * @return the marker, or empty when none was added
     * @throws InvariantViolationException for an inside marker on a box that already has children
     */
    public Optional<Box> addListMarker(BlockBox box) {
        Optional<Box> created = createMarker(box);
        if (created.isEmpty()) {
            return created;
        }
        Box marker = created.get();

        if (box.style().listStylePosition() == ListStylePosition.INSIDE) {
            if (box.hasChildren()) {
                throw new InvariantViolationException(
                        "Inside list marker must be the first child, but " + box + " has children");
            }
            box.addChild(marker);
            box.addChild(TextBox.inside(box, INSIDE_SPACER));
        } else {
            box.setOutsideListMarker(marker);
            marker.inheritStyleFrom(box);
        }
        return created;
    }

    private Optional<Box> createMarker(BlockBox box) {
        ComputedStyle style = box.style();
        ComputedStyle markerStyle = ComputedStyle.inheritedFrom(style);

        if (style.hasListStyleImage()) {
            Optional<ImageSurface> image = box.document().resolveImage(style.listStyleImage());
            if (image.isPresent()) {
                return Optional.of(
                        new ImageMarkerBox(
                                box.document(), box.element(), markerStyle, image.get()));
            }
            logger.debug(
                    "List marker image '{}' for {} is unavailable, using list-style-type {}",
                    style.listStyleImage(),
                    box.element(),
                    style.listStyleType().keyword());
        }

        String glyph = GLYPHS.get(style.listStyleType());
        if (glyph == null) {
            return Optional.empty();
        }
        return Optional.of(new TextBox(box.document(), box.element(), markerStyle, glyph));
    }
}
