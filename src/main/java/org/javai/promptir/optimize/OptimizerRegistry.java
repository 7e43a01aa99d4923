package org.javai.promptir.optimize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Optimizer back-ends by name.
 * <p>
 * The registry is a plain value owned by the caller. The first registration for a name wins;
 * later ones are logged and ignored.
 */
public class OptimizerRegistry {

	private static final Logger logger = LoggerFactory.getLogger(OptimizerRegistry.class);

	private final Map<String, Supplier<OptimizerBackend>> factories = new LinkedHashMap<>();

	/**
	 * @return true if the factory was registered, false if the name was taken
	 * @throws IllegalArgumentException if name is null or blank, or factory is null
	 */
	public boolean register(String name, Supplier<OptimizerBackend> factory) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Optimizer name cannot be null or empty");
		}
		if (factory == null) {
			throw new IllegalArgumentException("Optimizer factory cannot be null");
		}
		if (factories.containsKey(name)) {
			logger.debug("Optimizer '{}' already registered, ignoring later registration", name);
			return false;
		}
		factories.put(name, factory);
		return true;
	}

	/**
	 * Creates a fresh back-end for the name.
	 */
	public Optional<OptimizerBackend> create(String name) {
		Supplier<OptimizerBackend> factory = factories.get(name);
		return factory == null ? Optional.empty() : Optional.of(factory.get());
	}

	public boolean isRegistered(String name) {
		return factories.containsKey(name);
	}

	public Set<String> names() {
		return Collections.unmodifiableSet(factories.keySet());
	}
}
