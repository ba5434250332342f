package io.tessera.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tessera.core.model.SettingsEntry;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes pools, variables and connections as their settings records.
///
/// ```
/// Entity       Fields
/// ------------+--------------------------------------------------------------
/// Pool        │ pool_name, pool_slot, pool_description
/// Variable    │ variable_name, variable_value
/// Connection  │ conn_id, conn_type, conn_host, conn_schema, conn_login,
///             │ conn_password, conn_port, conn_extra (unset fields omitted)
/// ```
///
/// @implNote Package-private. Registered by {@link TesseraJacksonModule}.
class SettingsEntrySerializer extends StdSerializer<SettingsEntry> {

    @Serial private static final long serialVersionUID = 4410729181963820337L;

    SettingsEntrySerializer() {
        super(SettingsEntry.class);
    }

    @Override
    public void serialize(SettingsEntry entry, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Object> field : entry.toSettings().entrySet()) {
            provider.defaultSerializeField(field.getKey(), field.getValue(), gen);
        }
        gen.writeEndObject();
    }
}
