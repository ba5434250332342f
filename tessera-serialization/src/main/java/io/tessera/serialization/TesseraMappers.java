package io.tessera.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/// Factory for the Jackson mappers used to write project artifacts.
///
/// ### Usage
/// {@snippet :
/// // Settings document
/// String yaml = TesseraMappers.createYamlMapper().writeValueAsString(document);
///
/// // Analysis as a JSON record list
/// String json = TesseraMappers.createJsonMapper().writeValueAsString(analysis);
/// }
///
/// @implNote Thread-safe. A new mapper is created per call. For
/// high-throughput scenarios, cache the mapper.
///
/// @see TesseraJacksonModule for the registered type handlers
public final class TesseraMappers {

    private TesseraMappers() {}

    /// Creates a JSON mapper with the Tessera module registered.
    ///
    /// @return configured mapper, never null
    public static ObjectMapper createJsonMapper() {
        return JsonMapper.builder()
                .addModule(new TesseraJacksonModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    /// Creates a YAML mapper for the settings document.
    ///
    /// Registers:
    /// - `TesseraJacksonModule` for settings entries
    /// - no `---` document start marker
    /// - minimal quoting of string scalars
    ///
    /// @return configured mapper, never null
    public static YAMLMapper createYamlMapper() {
        return YAMLMapper.builder()
                .addModule(new TesseraJacksonModule())
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .build();
    }

    /// Creates a CSV mapper for delimited analysis output.
    ///
    /// @return configured mapper, never null
    public static CsvMapper createCsvMapper() {
        return CsvMapper.builder().addModule(new TesseraJacksonModule()).build();
    }
}
