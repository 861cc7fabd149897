package org.energycal.catalog;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SourceCatalogTest {

    private static SourceCatalog loadResource(String name) throws IOException {
        try (InputStream in = SourceCatalogTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(in, name);
            return SourceCatalog.load(in);
        }
    }

    private static InputStream text(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadsSingleQuotedCatalogInDocumentOrder() throws IOException {
        SourceCatalog catalog = loadResource("sources-python-style.txt");

        List<String> names = catalog.getSources().stream().map(CatalogSource::getName).collect(Collectors.toList());
        assertEquals(List.of("Ba-133", "Blank", "Eu-152"), names);

        CatalogSource barium = catalog.find("Ba-133").orElseThrow();
        assertEquals(2, barium.getEnergies().size());
        assertEquals(80.9979, barium.getEnergies().get(0).getValue(), 0);
        assertEquals("Ba-133 356 keV", barium.getEnergies().get(1).getDescription());
    }

    @Test
    void missingEnergiesAndDescriptionsDefaultToEmpty() throws IOException {
        SourceCatalog catalog = loadResource("sources-python-style.txt");

        assertTrue(catalog.find("Blank").orElseThrow().getEnergies().isEmpty());
        assertEquals("", catalog.find("Eu-152").orElseThrow().getEnergies().get(0).getDescription());
        assertFalse(catalog.find("Pu-239").isPresent());
    }

    @Test
    void energyWithoutValueIsRejected() {
        assertThrows(IOException.class, () -> loadResource("sources-bad.json"));
    }

    @Test
    void documentWithoutSourcesIsRejected() {
        assertThrows(IOException.class, () -> SourceCatalog.load(text("{\"other\": 1}")));
        assertThrows(IOException.class, () -> SourceCatalog.load(text("")));
    }

    @Test
    void malformedDocumentIsRejected() {
        assertThrows(IOException.class, () -> SourceCatalog.load(text("{\"sources\": {")));
    }

    @Test
    void emptyCatalogHasNoSources() {
        assertTrue(SourceCatalog.empty().getSources().isEmpty());
    }
}
