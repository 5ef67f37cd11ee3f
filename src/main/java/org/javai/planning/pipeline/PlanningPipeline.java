package org.javai.planning.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.javai.planning.api.ConfigurationException;
import org.javai.planning.api.PlannerFunction;
import org.javai.planning.api.PlannerManager;
import org.javai.planning.api.PlanningContext;
import org.javai.planning.api.PlanningPipelineException;
import org.javai.planning.api.PlanningRequestAdapter;
import org.javai.planning.api.PlanningScene;
import org.javai.planning.api.TerminationSignal;
import org.javai.planning.config.PipelineSettings;
import org.javai.planning.diagnostics.ContactMarkers;
import org.javai.planning.diagnostics.DiagnosticSink;
import org.javai.planning.diagnostics.DisplayTrajectory;
import org.javai.planning.model.ErrorCode;
import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.MotionPlanResponse;
import org.javai.planning.model.RobotModel;
import org.javai.planning.model.RobotState;
import org.javai.planning.model.RobotTrajectory;
import org.javai.planning.plugin.CapabilityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a named planner behind a named, ordered chain of request adapters.
 *
 * <p>A pipeline resolves its planner and adapters from a {@link CapabilityRegistry} when it is
 * configured, then serves {@link #generatePlan} calls one at a time:</p>
 *
 * <pre>{@code
 * PlanningPipeline pipeline = new PlanningPipeline(robotModel, registry, sink);
 * pipeline.configure("ompl_interface/OMPLPlanner",
 *     List.of("default_planner_request_adapters/FixStartStateBounds",
 *             "default_planner_request_adapters/AddTimeOptimalParameterization"));
 * PlanningResult result = pipeline.generatePlan(scene, request);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>At most one plan is computed at a time. A {@code generatePlan} or {@code configure} call that
 * arrives while a plan is being computed fails with {@link PipelineBusyException}. {@link #terminate()},
 * {@link #isActive()} and the accessors may be called from any thread at any time.</p>
 *
 * <h2>Errors</h2>
 * <p>Structural problems (no planner bound, unresolvable plugin names, busy pipeline) are thrown.
 * Failing to find a valid plan is not an error: it is reported through {@link PlanningResult#success()}
 * and the response's error code and message.</p>
 */
public class PlanningPipeline {

	/** Channel computed plans are published on when they are displayed. */
	public static final String DISPLAY_PATH_CHANNEL = "display_planned_path";

	/** Channel received requests are published on before processing begins. */
	public static final String MOTION_PLAN_REQUEST_CHANNEL = "motion_plan_request";

	/** Channel contacts found while re-checking a plan are published on. */
	public static final String MOTION_CONTACTS_CHANNEL = "display_contacts";

	private static final Logger logger = LoggerFactory.getLogger(PlanningPipeline.class);

	private final RobotModel robotModel;
	private final CapabilityRegistry registry;
	private final DiagnosticSink diagnosticSink;
	private final GenerationOptions defaultOptions;
	private final SolutionChecker solutionChecker = new SolutionChecker();

	private final AtomicBoolean active = new AtomicBoolean(false);
	private final TerminationSignal terminationSignal = new TerminationSignal();
	// guards the active flag together with the termination signal
	private final Object activity = new Object();
	// held for the whole of configure() and the solve phase of generatePlan(); not reentrant
	private final Semaphore planPermit = new Semaphore(1);

	// null until configure() succeeds
	private volatile Configuration configuration;

	public PlanningPipeline(RobotModel robotModel, CapabilityRegistry registry, DiagnosticSink diagnosticSink) {
		this(robotModel, registry, diagnosticSink, GenerationOptions.defaults());
	}

	public PlanningPipeline(RobotModel robotModel, CapabilityRegistry registry, DiagnosticSink diagnosticSink,
			GenerationOptions defaultOptions) {
		this.robotModel = Objects.requireNonNull(robotModel, "robotModel must not be null");
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.diagnosticSink = diagnosticSink != null ? diagnosticSink : DiagnosticSink.NO_OP;
		this.defaultOptions = defaultOptions != null ? defaultOptions : GenerationOptions.defaults();
	}

	/**
	 * Creates a pipeline and configures it with the given planner and adapters.
	 *
	 * @throws ConfigurationException if a name cannot be resolved or a plugin fails to initialize
	 */
	public PlanningPipeline(RobotModel robotModel, CapabilityRegistry registry, DiagnosticSink diagnosticSink,
			String plannerPluginName, List<String> adapterPluginNames) {
		this(robotModel, registry, diagnosticSink);
		configure(plannerPluginName, adapterPluginNames);
	}

	/**
	 * Creates and configures a pipeline from materialized settings. The settings' publish and check
	 * switches become the pipeline's default {@link GenerationOptions}.
	 *
	 * @throws ConfigurationException if a name cannot be resolved or a plugin fails to initialize
	 */
	public static PlanningPipeline fromSettings(RobotModel robotModel, CapabilityRegistry registry,
			DiagnosticSink diagnosticSink, PipelineSettings settings) {
		Objects.requireNonNull(settings, "settings must not be null");
		GenerationOptions options = new GenerationOptions(
				settings.publishReceivedRequests(),
				settings.checkSolutionPaths(),
				settings.displayComputedMotionPlans());
		PlanningPipeline pipeline = new PlanningPipeline(robotModel, registry, diagnosticSink, options);
		pipeline.configure(settings.planningPlugin(), settings.plannerParameters(),
				settings.requestAdapters(), settings::parametersFor);
		return pipeline;
	}

	/**
	 * Resolve and initialize a planner and adapters without plugin parameters.
	 *
	 * @see #configure(String, Map, List, Function)
	 */
	public void configure(String plannerPluginName, List<String> adapterPluginNames) {
		configure(plannerPluginName, Map.of(), adapterPluginNames, name -> Map.of());
	}

	/**
	 * Resolve and initialize the planner and every adapter, in order, and bind them to this pipeline.
	 * <p>
	 * On success the new planner and chain replace any previous ones atomically. On failure the
	 * pipeline is left without a planner and cannot plan until a later call succeeds.
	 *
	 * @param plannerPluginName registry name of the planner
	 * @param plannerParameters settings passed to {@link PlannerManager#initialize}
	 * @param adapterPluginNames registry names of the adapters, outermost first
	 * @param adapterParameters settings for each adapter, by adapter name
	 * @throws ConfigurationException if a name cannot be resolved or a plugin fails to initialize
	 * @throws PipelineBusyException if a plan is being computed
	 */
	public void configure(String plannerPluginName, Map<String, Object> plannerParameters,
			List<String> adapterPluginNames, Function<String, Map<String, Object>> adapterParameters) {
		Objects.requireNonNull(adapterPluginNames, "adapterPluginNames must not be null");
		Objects.requireNonNull(adapterParameters, "adapterParameters must not be null");
		if (!planPermit.tryAcquire()) {
			throw new PipelineBusyException("Cannot reconfigure the pipeline while a plan is being computed");
		}
		try {
			this.configuration = null;
			this.configuration = buildConfiguration(plannerPluginName,
					plannerParameters != null ? plannerParameters : Map.of(),
					adapterPluginNames, adapterParameters);
		}
		finally {
			planPermit.release();
		}
	}

	private Configuration buildConfiguration(String plannerPluginName, Map<String, Object> plannerParameters,
			List<String> adapterPluginNames, Function<String, Map<String, Object>> adapterParameters) {
		if (plannerPluginName == null || plannerPluginName.isBlank()) {
			throw new ConfigurationException("No planning plugin name specified");
		}

		PlannerManager planner;
		try {
			planner = registry.resolvePlanner(plannerPluginName);
		}
		catch (ConfigurationException e) {
			logger.error("Unable to load planning plugin '{}': {}", plannerPluginName, e.getMessage());
			throw e;
		}
		initializePlanner(plannerPluginName, planner, plannerParameters);
		logger.info("Using planning interface '{}'", planner.description());

		List<PlanningRequestAdapter> adapters = new ArrayList<>(adapterPluginNames.size());
		for (String adapterName : adapterPluginNames) {
			PlanningRequestAdapter adapter;
			try {
				adapter = registry.resolveAdapter(adapterName);
			}
			catch (ConfigurationException e) {
				logger.error("Unable to load planning request adapter '{}': {}", adapterName, e.getMessage());
				throw e;
			}
			initializeAdapter(adapterName, adapter, adapterParameters.apply(adapterName));
			logger.info("Using planning request adapter '{}'", adapter.description());
			adapters.add(adapter);
		}

		return new Configuration(plannerPluginName, List.copyOf(adapterPluginNames), planner,
				new AdapterChain(adapters), plannerFunction(planner, terminationSignal));
	}

	private void initializePlanner(String name, PlannerManager planner, Map<String, Object> parameters) {
		boolean initialized;
		try {
			initialized = planner.initialize(robotModel, parameters);
		}
		catch (RuntimeException e) {
			throw new ConfigurationException("Planning plugin '" + name + "' failed to initialize: " + e.getMessage(), e);
		}
		if (!initialized) {
			throw new ConfigurationException("Unable to initialize planning plugin '" + name + "' for robot model '"
					+ robotModel.name() + "'");
		}
	}

	private static void initializeAdapter(String name, PlanningRequestAdapter adapter, Map<String, Object> parameters) {
		try {
			adapter.initialize(parameters != null ? parameters : Map.of());
		}
		catch (RuntimeException e) {
			throw new ConfigurationException("Planning request adapter '" + name + "' failed to initialize: "
					+ e.getMessage(), e);
		}
	}

	/**
	 * The terminal stage of the chain: one planning context per request, solved and then cleared.
	 */
	private static PlannerFunction plannerFunction(PlannerManager planner, TerminationSignal signal) {
		return (scene, request, response) -> {
			Optional<PlanningContext> context = planner.planningContext(scene, request, signal, response);
			if (context.isEmpty()) {
				if (response.isSuccess()) {
					response.fail(ErrorCode.PLANNING_FAILED,
							"Planner '" + planner.description() + "' could not create a planning context");
				}
				return false;
			}
			PlanningContext planningContext = context.get();
			try {
				return planningContext.solve(response);
			}
			finally {
				planningContext.clear();
			}
		};
	}

	/**
	 * Plan with this pipeline's default options.
	 *
	 * @see #generatePlan(PlanningScene, MotionPlanRequest, GenerationOptions)
	 */
	public PlanningResult generatePlan(PlanningScene scene, MotionPlanRequest request) {
		return generatePlan(scene, request, defaultOptions);
	}

	/**
	 * Run {@code request} through the adapter chain and the planner, then optionally re-check and publish
	 * the result.
	 *
	 * @param scene the scene to plan in
	 * @param request the planning problem
	 * @param options per-call publish and check switches
	 * @return the result; {@code success} is false if no valid plan was found
	 * @throws PipelineNotConfiguredException if no planner is bound
	 * @throws PipelineBusyException if another plan is being computed
	 */
	public PlanningResult generatePlan(PlanningScene scene, MotionPlanRequest request, GenerationOptions options) {
		Objects.requireNonNull(scene, "scene must not be null");
		Objects.requireNonNull(request, "request must not be null");
		Objects.requireNonNull(options, "options must not be null");

		if (configuration == null) {
			throw new PipelineNotConfiguredException("No planning plugin loaded. Cannot plan.");
		}

		if (options.publishReceivedRequests()) {
			publish(MOTION_PLAN_REQUEST_CHANNEL, request);
		}

		if (!planPermit.tryAcquire()) {
			throw new PipelineBusyException("A plan is already being computed by this pipeline");
		}
		ChainResult outcome;
		try {
			Configuration config = this.configuration;
			if (config == null) {
				throw new PipelineNotConfiguredException("No planning plugin loaded. Cannot plan.");
			}
			outcome = solve(config, scene, request);
		}
		finally {
			planPermit.release();
		}

		MotionPlanResponse response = outcome.response();
		if (!outcome.success()) {
			if (response.isSuccess()) {
				response.fail(ErrorCode.PLANNING_FAILED, "Planning failed without reporting a reason");
			}
			logPlanningFailure(request, response);
			return new PlanningResult(false, response);
		}

		RobotTrajectory trajectory = response.trajectory();
		if (trajectory == null) {
			logger.debug("Planner reported success without a trajectory");
			return new PlanningResult(true, response);
		}
		logger.debug("Motion planner reported a solution path with {} states", trajectory.waypointCount());

		boolean valid = true;
		if (options.checkSolutionPaths()) {
			SolutionCheckResult check = solutionChecker.check(scene, request, trajectory,
					outcome.addedWaypointIndices());
			if (!check.valid()) {
				valid = false;
				response.addContacts(check.contacts());
				response.fail(ErrorCode.INVALID_MOTION_PLAN, "Computed path is not valid. Invalid states at index locations: "
						+ check.invalidWaypoints() + " out of " + trajectory.waypointCount());
			}
			publish(MOTION_CONTACTS_CHANNEL, new ContactMarkers(scene.planningFrame(), true, check.contacts()));
		}

		if (valid && options.displayComputedMotionPlans()) {
			publish(DISPLAY_PATH_CHANNEL, new DisplayTrajectory(robotModel.name(),
					trajectoryStart(trajectory, response, request), List.of(trajectory)));
		}

		return new PlanningResult(valid, response);
	}

	/**
	 * The active phase: the flag is raised only while the chain runs and is lowered on every exit path.
	 */
	private ChainResult solve(Configuration config, PlanningScene scene, MotionPlanRequest request) {
		synchronized (activity) {
			terminationSignal.reset();
			active.set(true);
		}
		try {
			return config.chain().adaptAndPlan(config.plannerFunction(), scene, request);
		}
		catch (PlanningPipelineException e) {
			throw e;
		}
		catch (RuntimeException e) {
			logger.error("Exception caught while planning for group '{}': '{}'", request.groupName(), e.getMessage(), e);
			MotionPlanResponse failed = new MotionPlanResponse();
			failed.fail(ErrorCode.FAILURE, "Planning failed with an exception: " + e.getMessage());
			return new ChainResult(false, failed, List.of());
		}
		finally {
			synchronized (activity) {
				active.set(false);
			}
		}
	}

	/**
	 * Ask the plan being computed, if any, to stop. The planner honors the request at its next check of
	 * the termination signal; this call does not wait for it.
	 */
	public void terminate() {
		synchronized (activity) {
			if (!active.get()) {
				logger.debug("Termination requested while no plan is being computed; ignoring");
				return;
			}
			terminationSignal.requestStop();
		}
		logger.info("Requested termination of the plan being computed");
	}

	/**
	 * Whether a plan is being computed right now.
	 */
	public boolean isActive() {
		return active.get();
	}

	public boolean isConfigured() {
		return configuration != null;
	}

	/**
	 * @return the configured planner name, or an empty string if the pipeline is not configured
	 */
	public String getPlannerPluginName() {
		Configuration config = configuration;
		return config != null ? config.plannerPluginName() : "";
	}

	/**
	 * @return the configured adapter names, outermost first, or an empty list if the pipeline is not configured
	 */
	public List<String> getAdapterPluginNames() {
		Configuration config = configuration;
		return config != null ? config.adapterPluginNames() : List.of();
	}

	public Optional<PlannerManager> getPlannerManager() {
		Configuration config = configuration;
		return config != null ? Optional.of(config.planner()) : Optional.empty();
	}

	public RobotModel getRobotModel() {
		return robotModel;
	}

	public GenerationOptions getDefaultOptions() {
		return defaultOptions;
	}

	private void publish(String channel, Object message) {
		try {
			diagnosticSink.publish(channel, message);
		}
		catch (RuntimeException e) {
			logger.warn("Failed to publish diagnostic message on '{}': {}", channel, e.getMessage(), e);
		}
	}

	private static void logPlanningFailure(MotionPlanRequest request, MotionPlanResponse response) {
		logger.info("Planning failed for group '{}': {} {}", request.groupName(), response.errorCode(), response.message());
		if (request.hasStackedConstraints()) {
			logger.warn("More than one constraint is set. If your robot does not have multiple end effectors or arms, "
					+ "this is unusual. Are pose targets from a previous request still set?");
		}
	}

	private static RobotState trajectoryStart(RobotTrajectory trajectory, MotionPlanResponse response,
			MotionPlanRequest request) {
		if (!trajectory.isEmpty()) {
			return trajectory.firstWaypoint();
		}
		return response.startState() != null ? response.startState() : request.startState();
	}

	private record Configuration(
			String plannerPluginName,
			List<String> adapterPluginNames,
			PlannerManager planner,
			AdapterChain chain,
			PlannerFunction plannerFunction
	) {
	}
}
