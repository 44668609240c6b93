package villagecompute.newsence.processors;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;

import villagecompute.newsence.data.models.SourceType;

class ProcessorRegistryTest {

    private static ItemProcessor processorFor(SourceType type) {
        ItemProcessor processor = mock(ItemProcessor.class);
        when(processor.sourceType()).thenReturn(type);
        return processor;
    }

    @Test
    void testForType_KnownAndUnknownTypes() {
        ItemProcessor fallback = processorFor(SourceType.DEFAULT);
        ItemProcessor youtube = processorFor(SourceType.YOUTUBE);
        ProcessorRegistry registry = new ProcessorRegistry(List.of(fallback, youtube));

        assertSame(youtube, registry.forType("youtube"));
        assertSame(fallback, registry.forType("telegram"));
        assertSame(fallback, registry.forType(null));
    }

    @Test
    void testConstructor_RequiresDefaultProcessor() {
        List<ItemProcessor> processors = List.of(processorFor(SourceType.WEB));

        assertThrows(IllegalStateException.class, () -> new ProcessorRegistry(processors));
    }

    @Test
    void testConstructor_RejectsDuplicates() {
        List<ItemProcessor> processors = List.of(processorFor(SourceType.DEFAULT), processorFor(SourceType.DEFAULT));

        assertThrows(IllegalStateException.class, () -> new ProcessorRegistry(processors));
    }
}
