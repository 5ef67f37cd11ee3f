package org.javai.planning.plugin;

import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.javai.planning.api.PlannerManager;
import org.javai.planning.api.PlanningRequestAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link CapabilityRegistry} backed by name to factory maps.
 *
 * <p>The usual way to build one is {@link #discover()}, which registers every
 * {@link PlannerProvider} and {@link AdapterProvider} found through Java's ServiceLoader:</p>
 *
 * <pre>{@code
 * CapabilityRegistry registry = DefaultCapabilityRegistry.discover();
 * }</pre>
 *
 * <p>Manual registration is also supported:</p>
 * <pre>{@code
 * DefaultCapabilityRegistry registry = new DefaultCapabilityRegistry()
 *     .registerPlanner("ompl_interface/OMPLPlanner", OmplPlannerManager::new)
 *     .registerAdapter("default_planner_request_adapters/FixStartStateBounds", FixStartStateBounds::new);
 * }</pre>
 *
 * <p>Registration and resolution are thread-safe.</p>
 */
public final class DefaultCapabilityRegistry implements CapabilityRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DefaultCapabilityRegistry.class);

	private final Map<String, Supplier<? extends PlannerManager>> planners = new ConcurrentHashMap<>();
	private final Map<String, Supplier<? extends PlanningRequestAdapter>> adapters = new ConcurrentHashMap<>();

	public DefaultCapabilityRegistry registerPlanner(String name, Supplier<? extends PlannerManager> factory) {
		Objects.requireNonNull(factory, "factory must not be null");
		String key = normalize(name);
		if (planners.putIfAbsent(key, factory) != null) {
			throw new IllegalArgumentException("Duplicate planner name: " + key);
		}
		logger.debug("Registered planner '{}'", key);
		return this;
	}

	public DefaultCapabilityRegistry registerAdapter(String name, Supplier<? extends PlanningRequestAdapter> factory) {
		Objects.requireNonNull(factory, "factory must not be null");
		String key = normalize(name);
		if (adapters.putIfAbsent(key, factory) != null) {
			throw new IllegalArgumentException("Duplicate adapter name: " + key);
		}
		logger.debug("Registered adapter '{}'", key);
		return this;
	}

	@Override
	public PlannerManager resolvePlanner(String name) {
		String key = requireName(name, "planner");
		Supplier<? extends PlannerManager> factory = planners.get(key);
		if (factory == null) {
			throw new UnknownPluginException(key, "Unknown planner '" + key + "'; available planners: " + plannerNames());
		}
		return instantiate(key, factory, "planner");
	}

	@Override
	public PlanningRequestAdapter resolveAdapter(String name) {
		String key = requireName(name, "adapter");
		Supplier<? extends PlanningRequestAdapter> factory = adapters.get(key);
		if (factory == null) {
			throw new UnknownPluginException(key, "Unknown adapter '" + key + "'; available adapters: " + adapterNames());
		}
		return instantiate(key, factory, "adapter");
	}

	public Set<String> plannerNames() {
		return new TreeSet<>(planners.keySet());
	}

	public Set<String> adapterNames() {
		return new TreeSet<>(adapters.keySet());
	}

	/**
	 * Creates a registry from all providers registered in META-INF/services files on the
	 * thread context class loader.
	 */
	public static DefaultCapabilityRegistry discover() {
		return discover(Thread.currentThread().getContextClassLoader());
	}

	public static DefaultCapabilityRegistry discover(ClassLoader loader) {
		DefaultCapabilityRegistry registry = new DefaultCapabilityRegistry();

		for (PlannerProvider provider : ServiceLoader.load(PlannerProvider.class, loader)) {
			registry.registerPlanner(provider.name(), provider::create);
		}

		for (AdapterProvider provider : ServiceLoader.load(AdapterProvider.class, loader)) {
			registry.registerAdapter(provider.name(), provider::create);
		}

		logger.info("Discovered {} planner(s) and {} adapter(s)", registry.planners.size(), registry.adapters.size());
		return registry;
	}

	private static <T> T instantiate(String name, Supplier<? extends T> factory, String kind) {
		T instance;
		try {
			instance = factory.get();
		}
		catch (RuntimeException e) {
			throw new UnknownPluginException(name, "Failed to create " + kind + " '" + name + "': " + e.getMessage(), e);
		}
		if (instance == null) {
			throw new UnknownPluginException(name, "Factory for " + kind + " '" + name + "' returned null");
		}
		return instance;
	}

	private static String requireName(String name, String kind) {
		if (name == null || name.isBlank()) {
			throw new UnknownPluginException(String.valueOf(name), "No " + kind + " name specified");
		}
		return name.trim();
	}

	private static String normalize(String name) {
		if (name == null) {
			throw new IllegalArgumentException("name must not be null");
		}
		String trimmed = name.trim();
		if (trimmed.isEmpty()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		return trimmed;
	}
}
