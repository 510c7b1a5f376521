package canopy.core.service.fallback;

import static canopy.support.FakeReadingProvider.answer;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import canopy.core.model.provider.ProviderDescriptor;
import canopy.core.port.out.ReadingProvider;
import canopy.support.FakeReadingProvider;

@DisplayName("ProviderChain")
class ProviderChainTest {

    private static ProviderDescriptor descriptor(int rank, String name) {
        return new ProviderDescriptor(
                rank, name, 10, Duration.ofDays(5), Duration.ofSeconds(30), 2, 0.9, Set.of(), Optional.empty());
    }

    private static ReadingProvider provider(String name) {
        return FakeReadingProvider.of(name, answer(name, 1));
    }

    @Test
    @DisplayName("should order providers by rank and keep declaration order for ties")
    void shouldOrderByRankWithStableTies() {
        var chain = new ProviderChain(
                List.of(descriptor(2, "landsat"), descriptor(1, "sentinel2"), descriptor(2, "aster")),
                List.of(provider("aster"), provider("landsat"), provider("sentinel2")));

        assertEquals(
                List.of("sentinel2", "landsat", "aster"),
                chain.links().stream().map(ProviderChain.Link::name).toList());
        assertEquals(List.of(1, 2, 3), chain.links().stream().map(ProviderChain.Link::level).toList());
        assertEquals(4, chain.baselineLevel());
    }

    @Test
    @DisplayName("should look up links by name")
    void shouldLookUpLinksByName() {
        var chain = new ProviderChain(List.of(descriptor(1, "sentinel2")), List.of(provider("sentinel2")));

        assertEquals(1, chain.link("sentinel2").orElseThrow().level());
        assertTrue(chain.link("modis").isEmpty());
    }

    @Test
    @DisplayName("should place the baseline at level one for an empty chain")
    void shouldPlaceBaselineAtLevelOneForEmptyChain() {
        var chain = new ProviderChain(List.of(), List.of());

        assertEquals(0, chain.size());
        assertEquals(1, chain.baselineLevel());
    }

    @Test
    @DisplayName("should reject a descriptor without an adapter")
    void shouldRejectDescriptorWithoutAdapter() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new ProviderChain(List.of(descriptor(1, "sentinel2")), List.of(provider("landsat"))));
    }

    @Test
    @DisplayName("should reject duplicate provider names")
    void shouldRejectDuplicateNames() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new ProviderChain(
                        List.of(descriptor(1, "sentinel2"), descriptor(2, "sentinel2")),
                        List.of(provider("sentinel2"))));
    }
}
