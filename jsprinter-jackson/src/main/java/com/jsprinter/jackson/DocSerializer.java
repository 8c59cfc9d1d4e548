package com.jsprinter.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.jsprinter.doc.BreakParent;
import com.jsprinter.doc.Concat;
import com.jsprinter.doc.Doc;
import com.jsprinter.doc.Group;
import com.jsprinter.doc.IfBreak;
import com.jsprinter.doc.Indent;
import com.jsprinter.doc.Line;
import com.jsprinter.doc.LineSuffix;
import com.jsprinter.doc.Text;

import java.io.IOException;

/**
 * Writes a {@link Doc} in the formatter's doc JSON: text as a string, a concatenation
 * as an array, every other command as an object tagged with {@code type}.
 *
 * <pre>
 * ["import", " ", {"type": "group", "contents": [...], "break": false}]
 * </pre>
 */
public class DocSerializer extends JsonSerializer<Doc> {

    @Override
    public void serialize(Doc doc, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (doc instanceof Text text) {
            gen.writeString(text.text());
        } else if (doc instanceof Concat concat) {
            gen.writeStartArray();
            for (Doc part : concat.parts()) {
                serialize(part, gen, serializers);
            }
            gen.writeEndArray();
        } else if (doc instanceof Group group) {
            gen.writeStartObject();
            gen.writeStringField("type", "group");
            writeContents("contents", group.contents(), gen, serializers);
            gen.writeBooleanField("break", group.shouldBreak());
            gen.writeEndObject();
        } else if (doc instanceof Indent indent) {
            gen.writeStartObject();
            gen.writeStringField("type", "indent");
            writeContents("contents", indent.contents(), gen, serializers);
            gen.writeEndObject();
        } else if (doc instanceof Line line) {
            gen.writeStartObject();
            gen.writeStringField("type", "line");
            if (line.soft()) {
                gen.writeBooleanField("soft", true);
            }
            if (line.hard()) {
                gen.writeBooleanField("hard", true);
            }
            if (line.literal()) {
                gen.writeBooleanField("literal", true);
            }
            gen.writeEndObject();
        } else if (doc instanceof IfBreak ifBreak) {
            gen.writeStartObject();
            gen.writeStringField("type", "if-break");
            writeContents("breakContents", ifBreak.breakContents(), gen, serializers);
            writeContents("flatContents", ifBreak.flatContents(), gen, serializers);
            gen.writeEndObject();
        } else if (doc instanceof LineSuffix suffix) {
            gen.writeStartObject();
            gen.writeStringField("type", "line-suffix");
            writeContents("contents", suffix.contents(), gen, serializers);
            gen.writeEndObject();
        } else if (doc instanceof BreakParent) {
            gen.writeStartObject();
            gen.writeStringField("type", "break-parent");
            gen.writeEndObject();
        }
    }

    private void writeContents(String field, Doc contents, JsonGenerator gen,
                               SerializerProvider serializers) throws IOException {
        gen.writeFieldName(field);
        serialize(contents, gen, serializers);
    }

    @Override
    public Class<Doc> handledType() {
        return Doc.class;
    }
}
