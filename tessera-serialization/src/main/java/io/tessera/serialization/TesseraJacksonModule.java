package io.tessera.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.tessera.core.analysis.ProjectAnalysis;
import io.tessera.core.model.SettingsEntry;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Tessera serializers in one place.
///
/// - `SettingsEntry` (pools, variables, connections) - {@link SettingsEntrySerializer},
///   writes the entity's settings record
/// - `ProjectAnalysis` - {@link ProjectAnalysisSerializer}, writes the rows as a
///   record list
///
/// @implNote All registrations are explicit - no classpath scanning.
/// @see TesseraMappers for the pre-configured mappers
public class TesseraJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 1785402213530442417L;

    public TesseraJacksonModule() {
        super("TesseraJacksonModule");

        addSerializer(SettingsEntry.class, new SettingsEntrySerializer());
        addSerializer(ProjectAnalysis.class, new ProjectAnalysisSerializer());
    }
}
