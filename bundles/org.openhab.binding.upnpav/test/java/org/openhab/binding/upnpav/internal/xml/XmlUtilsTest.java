/**
 * Copyright (c) 2010-2024 Contributors to the openHAB project
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 */
package org.openhab.binding.upnpav.internal.xml;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.upnpav.internal.exception.MalformedXmlException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Tests for {@link XmlUtils}
 *
 * @author Michael Cumming - Initial contribution
 */
@NonNullByDefault
public class XmlUtilsTest {

    private static final String ITEM = "<item xmlns=\"urn:schemas-upnp-org:metadata-1-0/DIDL-Lite/\""
            + " xmlns:dc=\"http://purl.org/dc/elements/1.1/\" xmlns:upnp=\"urn:schemas-upnp-org:metadata-1-0/upnp/\""
            + " id=\"1\">" //
            + "<dc:title></dc:title>" //
            + "<upnp:artist>First</upnp:artist><upnp:artist>Second</upnp:artist>" //
            + "<title>not dc</title>" //
            + "</item>";

    @Test
    public void testParseRejectsEmptyInput() {
        assertThrows(MalformedXmlException.class, () -> XmlUtils.parse(""));
        assertThrows(MalformedXmlException.class, () -> XmlUtils.parse("   "));
    }

    @Test
    public void testParseRejectsMalformedInput() {
        assertThrows(MalformedXmlException.class, () -> XmlUtils.parse("<a><b></a>"));
    }

    @Test
    public void testParseRejectsDoctype() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE foo [<!ENTITY x \"boom\">]><foo>&x;</foo>";
        assertThrows(MalformedXmlException.class, () -> XmlUtils.parse(xml));
    }

    @Test
    public void testChildLookupsAreNamespaceAware() throws Exception {
        Element item = XmlUtils.parse(ITEM).getDocumentElement();

        assertEquals("", XmlUtils.findChildText(item, XmlNamespaces.DC, "title"));
        assertNull(XmlUtils.optionalChildText(item, XmlNamespaces.DC, "title"));
        assertEquals("not dc", XmlUtils.findChildText(item, XmlNamespaces.DIDL, "title"));
        assertNull(XmlUtils.findChild(item, XmlNamespaces.DC, "creator"));
        assertEquals(List.of("First", "Second"), XmlUtils.findAllChildText(item, XmlNamespaces.UPNP, "artist"));
        assertEquals(4, XmlUtils.childElements(item).size());
        assertEquals("1", XmlUtils.optionalAttribute(item, "id"));
        assertNull(XmlUtils.optionalAttribute(item, "parentID"));
    }

    @Test
    public void testSerializationOmitsDeclaration() {
        Document document = XmlUtils.newDocument();
        Element root = XmlUtils.createElement(document, XmlNamespaces.DIDL, "DIDL-Lite");
        XmlNamespaces.declareDidlNamespaces(root);
        document.appendChild(root);
        XmlUtils.appendTextElement(root, XmlNamespaces.DC, "title", "Song");
        XmlUtils.appendOptionalTextElement(root, XmlNamespaces.DC, "creator", null);
        XmlUtils.appendOptionalTextElement(root, XmlNamespaces.DC, "date", "");

        String xml = XmlUtils.toXmlString(root);
        assertFalse(xml.startsWith("<?xml"));
        assertTrue(xml.contains("<dc:title>Song</dc:title>"));
        assertFalse(xml.contains("creator"));
        assertFalse(xml.contains("date"));
    }

    @Test
    public void testSerializedOutputParsesBack() throws Exception {
        Document document = XmlUtils.newDocument();
        Element root = XmlUtils.createElement(document, XmlNamespaces.DIDL, "item");
        XmlNamespaces.declareDidlNamespaces(root);
        document.appendChild(root);
        XmlUtils.appendTextElement(root, XmlNamespaces.UPNP, "album", "A & B <live>");

        Element parsed = XmlUtils.parse(XmlUtils.toXmlString(root, true)).getDocumentElement();
        assertEquals("A & B <live>", XmlUtils.findChildText(parsed, XmlNamespaces.UPNP, "album"));
    }

    @Test
    public void testIllegalCharactersAreRemoved() {
        assertEquals("abc", XmlUtils.filterIllegalXmlChars("a\u0000b\u0007c"));
        assertEquals("tab\tnewline\n", XmlUtils.filterIllegalXmlChars("tab\tnewline\n"));
        assertEquals("\uD83C\uDFB5 note", XmlUtils.filterIllegalXmlChars("\uD83C\uDFB5 note"));
        assertEquals("lone", XmlUtils.filterIllegalXmlChars("lo\uD800ne"));
        assertEquals("x", XmlUtils.filterIllegalXmlChars("x\uFFFE"));
    }

    @Test
    public void testLegalCharacterRanges() {
        assertTrue(XmlUtils.isLegalXmlChar(0x9));
        assertTrue(XmlUtils.isLegalXmlChar('A'));
        assertTrue(XmlUtils.isLegalXmlChar(0x10000));
        assertFalse(XmlUtils.isLegalXmlChar(0x1F));
        assertFalse(XmlUtils.isLegalXmlChar(0xD800));
        assertFalse(XmlUtils.isLegalXmlChar(0xFFFF));
    }
}
