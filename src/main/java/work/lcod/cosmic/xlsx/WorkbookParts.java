package work.lcod.cosmic.xlsx;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the XML parts of an Office Open XML spreadsheet package.
 *
 * <p>Parts are produced in a fixed order (content types, root relationships, workbook, workbook relationships,
 * styles, then one worksheet per sheet) so identical workbooks always yield identical packages.
 */
public final class WorkbookParts {
    public static final String CONTENT_TYPES_PATH = "[Content_Types].xml";
    public static final String ROOT_RELS_PATH = "_rels/.rels";
    public static final String WORKBOOK_PATH = "xl/workbook.xml";
    public static final String WORKBOOK_RELS_PATH = "xl/_rels/workbook.xml.rels";
    public static final String STYLES_PATH = "xl/styles.xml";

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n";
    private static final String MAIN_NS = "http://schemas.openxmlformats.org/spreadsheetml/2006/main";
    private static final String DOC_RELS_NS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    private static final String PACKAGE_RELS_NS = "http://schemas.openxmlformats.org/package/2006/relationships";
    private static final String CONTENT_TYPES_NS = "http://schemas.openxmlformats.org/package/2006/content-types";

    private static final String WORKSHEET_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.worksheet+xml";
    private static final String WORKBOOK_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet.main+xml";
    private static final String STYLES_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.styles+xml";
    private static final String RELS_TYPE = "application/vnd.openxmlformats-package.relationships+xml";

    private static final String STYLES = XML_DECLARATION + """
        <styleSheet xmlns="http://schemas.openxmlformats.org/spreadsheetml/2006/main">\
        <fonts count="1"><font><sz val="11"/><name val="Calibri"/><family val="2"/></font></fonts>\
        <fills count="2"><fill><patternFill patternType="none"/></fill><fill><patternFill patternType="gray125"/></fill></fills>\
        <borders count="1"><border><left/><right/><top/><bottom/><diagonal/></border></borders>\
        <cellStyleXfs count="1"><xf numFmtId="0" fontId="0" fillId="0" borderId="0"/></cellStyleXfs>\
        <cellXfs count="2">\
        <xf numFmtId="0" fontId="0" fillId="0" borderId="0" xfId="0"/>\
        <xf numFmtId="14" fontId="0" fillId="0" borderId="0" xfId="0" applyNumberFormat="1"/>\
        </cellXfs>\
        <cellStyles count="1"><cellStyle name="Normal" xfId="0" builtinId="0"/></cellStyles>\
        </styleSheet>""";

    private WorkbookParts() {}

    public static List<PackagePart> parts(Workbook workbook) {
        var parts = new ArrayList<PackagePart>(5 + workbook.size());
        parts.add(new PackagePart(CONTENT_TYPES_PATH, contentTypes(workbook.size())));
        parts.add(new PackagePart(ROOT_RELS_PATH, rootRelationships()));
        parts.add(new PackagePart(WORKBOOK_PATH, workbook(workbook.sheets())));
        parts.add(new PackagePart(WORKBOOK_RELS_PATH, workbookRelationships(workbook.size())));
        parts.add(new PackagePart(STYLES_PATH, styles()));
        int position = 1;
        for (var sheet : workbook.sheets()) {
            parts.add(new PackagePart(worksheetPath(position++), worksheet(sheet)));
        }
        return List.copyOf(parts);
    }

    /**
     * Archive path of the worksheet at the given 1-based position.
     */
    public static String worksheetPath(int position) {
        return "xl/worksheets/sheet" + position + ".xml";
    }

    public static String contentTypes(int sheetCount) {
        var xml = new StringBuilder(XML_DECLARATION);
        xml.append("<Types xmlns=\"").append(CONTENT_TYPES_NS).append("\">");
        xml.append("<Default Extension=\"rels\" ContentType=\"").append(RELS_TYPE).append("\"/>");
        xml.append("<Default Extension=\"xml\" ContentType=\"application/xml\"/>");
        appendOverride(xml, "/" + WORKBOOK_PATH, WORKBOOK_TYPE);
        appendOverride(xml, "/" + STYLES_PATH, STYLES_TYPE);
        for (int i = 1; i <= sheetCount; i++) {
            appendOverride(xml, "/" + worksheetPath(i), WORKSHEET_TYPE);
        }
        return xml.append("</Types>").toString();
    }

    public static String rootRelationships() {
        return XML_DECLARATION
            + "<Relationships xmlns=\"" + PACKAGE_RELS_NS + "\">"
            + relationship("rId1", DOC_RELS_NS + "/officeDocument", WORKBOOK_PATH)
            + "</Relationships>";
    }

    public static String workbook(List<Sheet> sheets) {
        var xml = new StringBuilder(XML_DECLARATION);
        xml.append("<workbook xmlns=\"").append(MAIN_NS).append("\" xmlns:r=\"").append(DOC_RELS_NS).append("\">");
        xml.append("<sheets>");
        int id = 1;
        for (var sheet : sheets) {
            xml.append("<sheet name=\"").append(CellEncoder.escape(sheet.name()))
                .append("\" sheetId=\"").append(id)
                .append("\" r:id=\"rId").append(id).append("\"/>");
            id++;
        }
        return xml.append("</sheets></workbook>").toString();
    }

    /**
     * Worksheets take {@code rId1..rIdN}; the style part follows as {@code rId(N+1)}.
     */
    public static String workbookRelationships(int sheetCount) {
        var xml = new StringBuilder(XML_DECLARATION);
        xml.append("<Relationships xmlns=\"").append(PACKAGE_RELS_NS).append("\">");
        for (int i = 1; i <= sheetCount; i++) {
            xml.append(relationship("rId" + i, DOC_RELS_NS + "/worksheet", "worksheets/sheet" + i + ".xml"));
        }
        xml.append(relationship("rId" + (sheetCount + 1), DOC_RELS_NS + "/styles", "styles.xml"));
        return xml.append("</Relationships>").toString();
    }

    public static String styles() {
        return STYLES;
    }

    public static String worksheet(Sheet sheet) {
        var xml = new StringBuilder(XML_DECLARATION);
        xml.append("<worksheet xmlns=\"").append(MAIN_NS).append("\" xmlns:r=\"").append(DOC_RELS_NS).append("\">");
        xml.append("<sheetData>");
        int rowIndex = 1;
        for (var row : sheet.rows()) {
            if (row.isEmpty()) {
                xml.append("<row r=\"").append(rowIndex).append("\"/>");
            } else {
                xml.append("<row r=\"").append(rowIndex).append("\">");
                int columnIndex = 1;
                for (var value : row) {
                    xml.append(CellEncoder.encode(value, rowIndex, columnIndex++));
                }
                xml.append("</row>");
            }
            rowIndex++;
        }
        return xml.append("</sheetData></worksheet>").toString();
    }

    private static void appendOverride(StringBuilder xml, String partName, String contentType) {
        xml.append("<Override PartName=\"").append(partName).append("\" ContentType=\"").append(contentType).append("\"/>");
    }

    private static String relationship(String id, String type, String target) {
        return "<Relationship Id=\"" + id + "\" Type=\"" + type + "\" Target=\"" + target + "\"/>";
    }
}
