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

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Reads XML or XHTML into the {@link Element} model. Adjacent text and CDATA nodes are merged
 * into the {@code text} of their element or the {@code tail} of the preceding sibling node.
 */
public final class XmlSource {
    private static final Logger logger = LoggerFactory.getLogger(XmlSource.class);

    private static final String LOAD_EXTERNAL_DTD =
            "http://apache.org/xml/features/nonvalidating/load-external-dtd";
    private static final String EXTERNAL_GENERAL_ENTITIES =
            "http://xml.org/sax/features/external-general-entities";
    private static final String EXTERNAL_PARAMETER_ENTITIES =
            "http://xml.org/sax/features/external-parameter-entities";

    private XmlSource() {}

    public static Element parse(String xml) throws IOException {
        return parse(new InputSource(new StringReader(xml)));
    }

    public static Element parse(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            InputSource source = new InputSource(in);
            source.setSystemId(path.toUri().toString());
            return parse(source);
        }
    }

    private static Element parse(InputSource source) throws IOException {
        org.w3c.dom.Document dom;
        try {
            dom = newDocumentBuilder().parse(source);
        } catch (SAXException e) {
            throw new IOException("Malformed document: " + e.getMessage(), e);
        }
        Element root = convert(dom.getDocumentElement());
        logger.debug("Parsed document with root {}", root);
        return root;
    }

    private static DocumentBuilder newDocumentBuilder() throws IOException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(true);
        factory.setXIncludeAware(false);
        // Documents never reach outside themselves: no external DTDs, entities or schemas.
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        try {
            factory.setFeature(LOAD_EXTERNAL_DTD, false);
            factory.setFeature(EXTERNAL_GENERAL_ENTITIES, false);
            factory.setFeature(EXTERNAL_PARAMETER_ENTITIES, false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IOException("XML parser not available: " + e.getMessage(), e);
        }
    }

    private static Element convert(org.w3c.dom.Element domElem) {
        String name =
                domElem.getLocalName() != null ? domElem.getLocalName() : domElem.getTagName();
        Element out = new Element(name);

        NamedNodeMap attrs = domElem.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            String attrName = attr.getLocalName() != null ? attr.getLocalName() : attr.getName();
            if (!"xmlns".equals(attr.getPrefix()) && !"xmlns".equals(attr.getName())) {
                out.setAttribute(attrName, attr.getValue());
            }
        }

        StringBuilder pendingText = new StringBuilder();
        Node previous = null;
        NodeList kids = domElem.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            org.w3c.dom.Node kid = kids.item(i);
            Node converted =
                    switch (kid.getNodeType()) {
                        case org.w3c.dom.Node.ELEMENT_NODE -> convert((org.w3c.dom.Element) kid);
                        case org.w3c.dom.Node.COMMENT_NODE -> new Comment(kid.getNodeValue());
                        case org.w3c.dom.Node.PROCESSING_INSTRUCTION_NODE -> {
                            org.w3c.dom.ProcessingInstruction pi =
                                    (org.w3c.dom.ProcessingInstruction) kid;
                            yield new ProcessingInstruction(pi.getTarget(), pi.getData());
                        }
                        case org.w3c.dom.Node.TEXT_NODE,
                                org.w3c.dom.Node.CDATA_SECTION_NODE,
                                org.w3c.dom.Node.ENTITY_REFERENCE_NODE -> {
                            pendingText.append(kid.getTextContent());
                            yield null;
                        }
                        default -> null;
                    };
            if (converted == null) {
                continue;
            }
            flushText(out, previous, pendingText);
            out.appendChild(converted);
            previous = converted;
        }
        flushText(out, previous, pendingText);
        return out;
    }

    private static void flushText(Element owner, Node previous, StringBuilder pendingText) {
        if (pendingText.length() == 0) {
            return;
        }
        if (previous == null) {
            owner.setText(pendingText.toString());
        } else {
            previous.setTail(pendingText.toString());
        }
        pendingText.setLength(0);
    }
}
