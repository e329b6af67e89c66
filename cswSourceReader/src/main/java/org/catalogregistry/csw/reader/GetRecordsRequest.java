package org.catalogregistry.csw.reader;

/**
 * Builds CSW 2.0.2 {@code GetRecords} POST bodies for full Dublin Core records.
 */
public final class GetRecordsRequest {
    private GetRecordsRequest() {}

    /**
     * @param modifiedSince when not null, only records modified at or after this value are requested
     */
    public static String build(int startPosition, int maxRecords, String modifiedSince) {
        var xml = new StringBuilder()
            .append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
            .append("<csw:GetRecords xmlns:csw=\"").append(CswRecordParser.CSW_NS).append("\"")
            .append(" xmlns:ogc=\"http://www.opengis.net/ogc\"")
            .append(" xmlns:dct=\"").append(CswRecordParser.DCT_NS).append("\"")
            .append(" service=\"CSW\" version=\"2.0.2\" resultType=\"results\"")
            .append(" startPosition=\"").append(startPosition).append("\"")
            .append(" maxRecords=\"").append(maxRecords).append("\"")
            .append(" outputSchema=\"").append(CswRecordParser.CSW_NS).append("\">\n")
            .append("  <csw:Query typeNames=\"csw:Record\">\n")
            .append("    <csw:ElementSetName>full</csw:ElementSetName>\n");
        if (modifiedSince != null) {
            xml.append("    <csw:Constraint version=\"1.1.0\">\n")
                .append("      <ogc:Filter>\n")
                .append("        <ogc:PropertyIsGreaterThanOrEqualTo>\n")
                .append("          <ogc:PropertyName>dct:modified</ogc:PropertyName>\n")
                .append("          <ogc:Literal>").append(escape(modifiedSince)).append("</ogc:Literal>\n")
                .append("        </ogc:PropertyIsGreaterThanOrEqualTo>\n")
                .append("      </ogc:Filter>\n")
                .append("    </csw:Constraint>\n");
        }
        return xml.append("  </csw:Query>\n")
            .append("</csw:GetRecords>\n")
            .toString();
    }

    static String escape(String value) {
        return value.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }
}
