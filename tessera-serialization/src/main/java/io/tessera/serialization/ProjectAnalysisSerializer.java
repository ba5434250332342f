package io.tessera.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tessera.core.analysis.ProjectAnalysis;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a {@link ProjectAnalysis} as an array of row objects, totals last.
///
/// Each object holds only the cells present in its row, in column order.
///
/// @implNote Package-private. Registered by {@link TesseraJacksonModule}.
class ProjectAnalysisSerializer extends StdSerializer<ProjectAnalysis> {

    @Serial private static final long serialVersionUID = -6264531800129731920L;

    ProjectAnalysisSerializer() {
        super(ProjectAnalysis.class);
    }

    @Override
    public void serialize(ProjectAnalysis analysis, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        for (Map<String, Object> row : analysis.getRows()) {
            gen.writeStartObject();
            for (String column : analysis.getColumns()) {
                if (row.containsKey(column)) {
                    provider.defaultSerializeField(column, row.get(column), gen);
                }
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }
}
