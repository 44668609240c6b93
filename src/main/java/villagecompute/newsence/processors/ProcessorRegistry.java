package villagecompute.newsence.processors;

import java.util.EnumMap;
import java.util.Map;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.SourceType;

/**
 * Selects the processor for a stored source type. Types without a dedicated processor (including {@code rss}) use
 * the default one.
 */
@ApplicationScoped
public class ProcessorRegistry {

    private static final Logger LOG = Logger.getLogger(ProcessorRegistry.class);

    private final Map<SourceType, ItemProcessor> processors = new EnumMap<>(SourceType.class);

    @Inject
    public ProcessorRegistry(Instance<ItemProcessor> candidates) {
        this((Iterable<ItemProcessor>) candidates);
    }

    ProcessorRegistry(Iterable<ItemProcessor> candidates) {
        for (ItemProcessor processor : candidates) {
            ItemProcessor previous = processors.put(processor.sourceType(), processor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate processors for " + processor.sourceType() + ": "
                        + previous.getClass().getName() + " and " + processor.getClass().getName());
            }
        }
        if (!processors.containsKey(SourceType.DEFAULT)) {
            throw new IllegalStateException("No default item processor registered");
        }
        LOG.infof("Registered item processors: %s", processors.keySet());
    }

    public ItemProcessor forType(String sourceType) {
        return processors.getOrDefault(SourceType.fromValue(sourceType), processors.get(SourceType.DEFAULT));
    }
}
