package io.tessera.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.tessera.core.model.Connection;
import io.tessera.core.model.Pool;
import io.tessera.core.model.Variable;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class TesseraMappersTest {

    @Test
    void shouldWriteSettingsRecordsAsJson() throws Exception {
        var mapper = TesseraMappers.createJsonMapper();

        JsonNode node =
                mapper.readTree(
                        mapper.writeValueAsString(
                                List.of(new Pool("p1", 5, "etl"), new Variable("v1", "x"))));

        assertThat(node.get(0).get("pool_name").asText()).isEqualTo("p1");
        assertThat(node.get(0).get("pool_slot").asInt()).isEqualTo(5);
        assertThat(node.get(1).get("variable_value").asText()).isEqualTo("x");
    }

    @Test
    void shouldWriteConnectionWithoutUnsetFields() throws Exception {
        var connection =
                Connection.builder()
                        .connId("warehouse")
                        .connType("postgres")
                        .port(5432)
                        .extraEntry("sslmode", "require")
                        .build();

        var yaml = TesseraMappers.createYamlMapper().writeValueAsString(connection);

        assertThat(yaml)
                .isEqualTo(
                        "conn_id: warehouse\n"
                                + "conn_type: postgres\n"
                                + "conn_port: 5432\n"
                                + "conn_extra:\n"
                                + "  sslmode: require\n");
    }

    @Test
    void shouldOmitDocumentStartMarker() throws Exception {
        var yaml =
                TesseraMappers.createYamlMapper()
                        .writeValueAsString(Map.of("airflow", Map.of("pools", List.of())));

        assertThat(yaml).startsWith("airflow:");
    }
}
