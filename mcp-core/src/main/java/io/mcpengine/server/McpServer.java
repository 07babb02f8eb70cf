/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.mcpengine.json.McpJsonDefaults;
import io.mcpengine.json.McpJsonMapper;
import io.mcpengine.server.McpServerFeatures.PromptSpecification;
import io.mcpengine.server.McpServerFeatures.ResourceSpecification;
import io.mcpengine.server.McpServerFeatures.ToolSpecification;
import io.mcpengine.spec.JsonRpcCodec;
import io.mcpengine.spec.McpError;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.CallToolRequest;
import io.mcpengine.spec.McpSchema.CallToolResult;
import io.mcpengine.spec.McpSchema.CancelledNotification;
import io.mcpengine.spec.McpSchema.ErrorCodes;
import io.mcpengine.spec.McpSchema.GetPromptRequest;
import io.mcpengine.spec.McpSchema.Implementation;
import io.mcpengine.spec.McpSchema.InitializeRequest;
import io.mcpengine.spec.McpSchema.InitializeResult;
import io.mcpengine.spec.McpSchema.PaginatedRequest;
import io.mcpengine.spec.McpSchema.PromptArgument;
import io.mcpengine.spec.McpSchema.ReadResourceRequest;
import io.mcpengine.spec.McpSchema.ServerCapabilities;
import io.mcpengine.spec.McpSchema.SubscribeRequest;
import io.mcpengine.spec.McpSchema.UnsubscribeRequest;
import io.mcpengine.spec.McpServerTransport;
import io.mcpengine.spec.McpServerTransportProvider;
import io.mcpengine.util.Assert;
import io.mcpengine.util.ToolNameValidator;
import io.mcpengine.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

/**
 * An MCP server: the protocol methods, the registered tools, resources and prompts, and
 * the transport provider serving them.
 *
 * <pre>{@code
 * McpServer server = McpServer.builder(new StdioServerTransportProvider(jsonMapper))
 *     .serverInfo("my-server", "1.0.0")
 *     .tools(echoTool)
 *     .build();
 * server.onClose().block();
 * }</pre>
 *
 * The method registry is frozen when {@link Builder#build()} returns; tools, resources
 * and prompts live in repositories and may still change at runtime, in which case ready
 * sessions get a {@code list_changed} notification.
 */
public class McpServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpServer.class);

	private final McpServerTransportProvider transportProvider;

	private final JsonRpcCodec codec;

	private final McpJsonMapper jsonMapper;

	private final Implementation serverInfo;

	private final ServerCapabilities capabilities;

	private final String instructions;

	private final String protocolVersion;

	private final MethodRegistry registry;

	private final CancellationTracker cancellationTracker = new CancellationTracker();

	private final ToolsRepository toolsRepository;

	private final ResourcesRepository resourcesRepository;

	private final PromptsRepository promptsRepository;

	private final NotificationMode notificationMode;

	private final Duration notificationPollInterval;

	private final Scheduler notificationScheduler;

	private final Map<String, McpServerSession> sessions = new ConcurrentHashMap<>();

	private McpServer(Builder builder) {
		this.transportProvider = builder.transportProvider;
		this.jsonMapper = builder.jsonMapper != null ? builder.jsonMapper : McpJsonDefaults.getMapper();
		this.codec = new JsonRpcCodec(this.jsonMapper);
		this.serverInfo = builder.serverInfo;
		this.instructions = builder.instructions;
		this.protocolVersion = builder.protocolVersion;
		this.toolsRepository = builder.toolsRepository != null ? builder.toolsRepository
				: new InMemoryToolsRepository();
		this.resourcesRepository = builder.resourcesRepository != null ? builder.resourcesRepository
				: new InMemoryResourcesRepository();
		this.promptsRepository = builder.promptsRepository != null ? builder.promptsRepository
				: new InMemoryPromptsRepository();
		builder.tools.forEach(this::registerTool);
		builder.resources.forEach(this.resourcesRepository::addResource);
		builder.prompts.forEach(this.promptsRepository::addPrompt);
		this.capabilities = builder.capabilities != null ? builder.capabilities
				: ServerCapabilities.builder().tools(true).resources(true, true).prompts(true).build();
		this.notificationMode = builder.notificationMode;
		this.notificationPollInterval = builder.notificationPollInterval;
		this.notificationScheduler = this.notificationMode == NotificationMode.ASYNC
				? Schedulers.newSingle("mcp-notifications", true) : null;

		this.registry = new MethodRegistry();
		registerProtocolMethods();
		builder.methods.forEach(this.registry::add);
		this.registry.setOnBefore(builder.beforeHook)
			.setOnAfter(builder.afterHook)
			.setOnError(builder.errorHook)
			.setOnFallback(builder.fallbackHook);
		this.registry.freeze();
		logger.debug("Registered methods: {}", this.registry.methods());

		this.transportProvider.setSessionFactory(this::createSession);
	}

	public static Builder builder(McpServerTransportProvider transportProvider) {
		return new Builder(transportProvider);
	}

	private McpServerSession createSession(McpServerTransport transport) {
		NotificationDeliveryService deliveryService = this.notificationMode == NotificationMode.ASYNC
				? new NotificationDeliveryService(transport::send, this.notificationPollInterval,
						this.notificationScheduler)
				: null;
		McpServerSession session = new McpServerSession(transport, this.codec, this.registry,
				this.cancellationTracker, this.protocolVersion, this.notificationMode, deliveryService);
		this.sessions.put(session.getId(), session);
		session.addCloseListener(() -> this.sessions.remove(session.getId()));
		logger.debug("Created session {}", session.getId());
		return session;
	}

	private void registerProtocolMethods() {
		this.registry.add(McpSchema.METHOD_INITIALIZE, this::initialize);
		this.registry.add(McpSchema.METHOD_NOTIFICATION_INITIALIZED, this::initialized);
		this.registry.add(McpSchema.METHOD_PING, (context, params) -> Map.of());
		this.registry.add(McpSchema.METHOD_SHUTDOWN, this::shutdown);
		this.registry.add(McpSchema.METHOD_NOTIFICATION_CANCELLED, this::cancelled);
		this.registry.add(McpSchema.METHOD_TOOLS_LIST, (context, params) -> this.toolsRepository
			.listTools(context, cursor(params, context.method())));
		this.registry.add(McpSchema.METHOD_TOOLS_CALL, (CancellableRequestHandler) this::callTool);
		this.registry.add(McpSchema.METHOD_RESOURCES_LIST, (context, params) -> this.resourcesRepository
			.listResources(context, cursor(params, context.method())));
		this.registry.add(McpSchema.METHOD_RESOURCES_READ, this::readResource);
		this.registry.add(McpSchema.METHOD_RESOURCES_SUBSCRIBE, this::subscribe);
		this.registry.add(McpSchema.METHOD_RESOURCES_UNSUBSCRIBE, this::unsubscribe);
		this.registry.add(McpSchema.METHOD_PROMPT_LIST, (context, params) -> this.promptsRepository
			.listPrompts(context, cursor(params, context.method())));
		this.registry.add(McpSchema.METHOD_PROMPT_GET, this::getPrompt);
	}

	// ---------------------------------------
	// Lifecycle
	// ---------------------------------------

	private Object initialize(McpRequestContext context, @Nullable Object params) {
		McpServerSession session = context.session();
		session.lifecycle().beginInitialize();
		if (params == null) {
			throw McpError.invalidParams("initialize requires params");
		}
		InitializeRequest request = bindParams(params, InitializeRequest.class, context.method());
		session.lifecycle().completeInitialize(request);
		logger.info("Session {} initialized by {} using protocol {}", session.getId(),
				request.clientInfo() != null ? request.clientInfo().name() : "unknown client",
				request.protocolVersion());
		return new InitializeResult(this.protocolVersion, this.capabilities, this.serverInfo, this.instructions);
	}

	private Object initialized(McpRequestContext context, @Nullable Object params) {
		logger.debug("Session {} confirmed initialization", context.sessionId());
		return DispatchResult.NONE;
	}

	private Object shutdown(McpRequestContext context, @Nullable Object params) {
		context.session().lifecycle().shutdown();
		logger.info("Session {} shut down by client", context.sessionId());
		return context.isNotification() ? DispatchResult.NONE : null;
	}

	private Object cancelled(McpRequestContext context, @Nullable Object params) {
		if (params == null) {
			logger.debug("Ignoring cancellation without params");
			return DispatchResult.NONE;
		}
		CancelledNotification notification = bindParams(params, CancelledNotification.class, context.method());
		if (notification.requestId() == null) {
			logger.debug("Ignoring cancellation without requestId");
			return DispatchResult.NONE;
		}
		this.cancellationTracker.cancel(context.session().getId(), notification.requestId(), notification.reason());
		return DispatchResult.NONE;
	}

	// ---------------------------------------
	// Tools
	// ---------------------------------------

	private Object callTool(McpRequestContext context, @Nullable Object params, CancellationToken token) {
		if (params == null) {
			throw McpError.invalidParams("tools/call requires params");
		}
		CallToolRequest bound = bindParams(params, CallToolRequest.class, context.method());
		String name = bound.name();
		if (!Utils.hasText(name)) {
			throw McpError.invalidParams("Missing tool name");
		}
		ToolSpecification tool = this.toolsRepository.resolveToolForCall(name, context)
			.orElseThrow(() -> McpError.builder(ErrorCodes.INVALID_PARAMS)
				.message("Unknown tool: " + name)
				.data(Map.of("tool", name))
				.build());
		// malformed _meta.progressToken is rejected before the tool runs
		bound.progressToken();
		CallToolRequest request = bound.arguments() != null ? bound
				: new CallToolRequest(name, Map.of(), bound.meta());

		CallToolResult result;
		try {
			result = tool.callHandler().call(context, request);
		}
		catch (McpError e) {
			throw e;
		}
		catch (RuntimeException e) {
			logger.warn("Tool '{}' failed", request.name(), e);
			throw McpError.builder(ErrorCodes.INTERNAL_ERROR)
				.message("Tool execution failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getName()))
				.cause(e)
				.build();
		}
		if (token.isCancelled()) {
			logger.debug("Tool '{}' returned after cancellation: {}", request.name(), token.reason());
		}
		if (result == null) {
			throw McpError.builder(ErrorCodes.INTERNAL_ERROR)
				.message("Tool execution failed: no result from '" + request.name() + "'")
				.build();
		}
		return result;
	}

	private void registerTool(ToolSpecification tool) {
		ToolNameValidator.validate(tool.tool().name());
		this.toolsRepository.addTool(tool);
	}

	/**
	 * Adds or replaces a tool and tells ready sessions the tool list changed.
	 * @param tool the tool
	 */
	public void addTool(ToolSpecification tool) {
		Assert.notNull(tool, "tool must not be null");
		registerTool(tool);
		logger.debug("Added tool handler: {}", tool.tool().name());
		notifyClients(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, null);
	}

	public void removeTool(String name) {
		Assert.hasText(name, "name must not be empty");
		if (this.toolsRepository.removeTool(name)) {
			logger.debug("Removed tool handler: {}", name);
			notifyClients(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, null);
		}
		else {
			logger.warn("Ignore as a Tool with name '{}' not found", name);
		}
	}

	// ---------------------------------------
	// Resources
	// ---------------------------------------

	private Object readResource(McpRequestContext context, @Nullable Object params) {
		ReadResourceRequest request = bindRequired(params, ReadResourceRequest.class, context.method());
		if (!Utils.hasText(request.uri())) {
			throw McpError.invalidParams("Missing uri");
		}
		ResourceSpecification resource = this.resourcesRepository.resolveResource(request.uri(), context)
			.orElseThrow(() -> McpError.RESOURCE_NOT_FOUND.apply(request.uri()));
		return resource.readHandler().read(context, request);
	}

	private Object subscribe(McpRequestContext context, @Nullable Object params) {
		SubscribeRequest request = bindRequired(params, SubscribeRequest.class, context.method());
		if (!Utils.hasText(request.uri())) {
			throw McpError.invalidParams("Missing uri");
		}
		if (this.resourcesRepository.resolveResource(request.uri(), context).isEmpty()) {
			throw McpError.RESOURCE_NOT_FOUND.apply(request.uri());
		}
		context.session().subscribe(request.uri());
		return Map.of();
	}

	private Object unsubscribe(McpRequestContext context, @Nullable Object params) {
		UnsubscribeRequest request = bindRequired(params, UnsubscribeRequest.class, context.method());
		if (!Utils.hasText(request.uri())) {
			throw McpError.invalidParams("Missing uri");
		}
		context.session().unsubscribe(request.uri());
		return Map.of();
	}

	public void addResource(ResourceSpecification resource) {
		Assert.notNull(resource, "resource must not be null");
		this.resourcesRepository.addResource(resource);
		logger.debug("Added resource handler: {}", resource.resource().uri());
		notifyClients(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED, null);
	}

	public void removeResource(String uri) {
		Assert.hasText(uri, "uri must not be empty");
		if (this.resourcesRepository.removeResource(uri)) {
			logger.debug("Removed resource handler: {}", uri);
			notifyClients(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED, null);
		}
		else {
			logger.warn("Ignore as a Resource with uri '{}' not found", uri);
		}
	}

	/**
	 * Tells the sessions subscribed to {@code uri} that the resource changed.
	 * @param uri the updated resource
	 * @return number of sessions notified
	 */
	public int notifyResourceUpdated(String uri) {
		Assert.hasText(uri, "uri must not be empty");
		int notified = 0;
		for (McpServerSession session : this.sessions.values()) {
			if (session.notifyResourceUpdated(uri)) {
				notified++;
			}
		}
		return notified;
	}

	// ---------------------------------------
	// Prompts
	// ---------------------------------------

	private Object getPrompt(McpRequestContext context, @Nullable Object params) {
		GetPromptRequest request = bindRequired(params, GetPromptRequest.class, context.method());
		if (!Utils.hasText(request.name())) {
			throw McpError.invalidParams("Missing prompt name");
		}
		PromptSpecification prompt = this.promptsRepository.resolvePrompt(request.name(), context)
			.orElseThrow(() -> McpError.invalidParams("Prompt not found: " + request.name()));
		List<PromptArgument> arguments = prompt.prompt().arguments();
		if (arguments != null) {
			for (PromptArgument argument : arguments) {
				if (Boolean.TRUE.equals(argument.required())
						&& (request.arguments() == null || request.arguments().get(argument.name()) == null)) {
					throw McpError.invalidParams("Missing required argument: " + argument.name());
				}
			}
		}
		return prompt.promptHandler().get(context, request);
	}

	public void addPrompt(PromptSpecification prompt) {
		Assert.notNull(prompt, "prompt must not be null");
		this.promptsRepository.addPrompt(prompt);
		logger.debug("Added prompt handler: {}", prompt.prompt().name());
		notifyClients(McpSchema.METHOD_NOTIFICATION_PROMPTS_LIST_CHANGED, null);
	}

	public void removePrompt(String name) {
		Assert.hasText(name, "name must not be empty");
		if (this.promptsRepository.removePrompt(name)) {
			logger.debug("Removed prompt handler: {}", name);
			notifyClients(McpSchema.METHOD_NOTIFICATION_PROMPTS_LIST_CHANGED, null);
		}
		else {
			logger.warn("Ignore as a Prompt with name '{}' not found", name);
		}
	}

	// ---------------------------------------
	// Notifications and shutdown
	// ---------------------------------------

	/**
	 * Sends a notification to every ready session.
	 * @param method notification method
	 * @param params notification params, may be {@code null}
	 * @return number of sessions notified
	 */
	public int notifyClients(String method, @Nullable Object params) {
		int notified = 0;
		for (McpServerSession session : this.sessions.values()) {
			if (session.notifyClient(method, params)) {
				notified++;
			}
		}
		return notified;
	}

	public Implementation getServerInfo() {
		return this.serverInfo;
	}

	public ServerCapabilities getCapabilities() {
		return this.capabilities;
	}

	public String getProtocolVersion() {
		return this.protocolVersion;
	}

	public MethodRegistry getMethodRegistry() {
		return this.registry;
	}

	public CancellationTracker getCancellationTracker() {
		return this.cancellationTracker;
	}

	public int getSessionCount() {
		return this.sessions.size();
	}

	/**
	 * @return a {@link Mono} completing when the transport provider stops serving
	 */
	public Mono<Void> onClose() {
		return this.transportProvider.onClose();
	}

	public Mono<Void> closeGracefully() {
		return this.transportProvider.closeGracefully().then(Mono.fromRunnable(() -> {
			new ArrayList<>(this.sessions.values()).forEach(McpServerSession::close);
			if (this.notificationScheduler != null) {
				this.notificationScheduler.dispose();
			}
			logger.info("Server {} closed", this.serverInfo.name());
		}));
	}

	@Override
	public void close() {
		closeGracefully().block();
	}

	// ---------------------------------------
	// Params binding
	// ---------------------------------------

	private <T> T bindRequired(@Nullable Object params, Class<T> type, String method) {
		if (params == null) {
			throw McpError.invalidParams(method + " requires params");
		}
		return bindParams(params, type, method);
	}

	private <T> T bindParams(Object params, Class<T> type, String method) {
		if (!(params instanceof Map)) {
			throw McpError.invalidParams("Params of " + method + " must be an object");
		}
		try {
			return this.jsonMapper.convertValue(params, type);
		}
		catch (IllegalArgumentException e) {
			throw McpError.builder(ErrorCodes.INVALID_PARAMS)
				.message("Invalid params for " + method + ": " + e.getMessage())
				.cause(e)
				.build();
		}
	}

	@Nullable
	private String cursor(@Nullable Object params, String method) {
		if (params == null) {
			return null;
		}
		return bindParams(params, PaginatedRequest.class, method).cursor();
	}

	/**
	 * Configures and starts an {@link McpServer}.
	 */
	public static class Builder {

		private final McpServerTransportProvider transportProvider;

		private McpJsonMapper jsonMapper;

		private Implementation serverInfo = new Implementation("mcp-server", "1.0.0");

		private ServerCapabilities capabilities;

		private String instructions;

		private String protocolVersion = McpSchema.LATEST_PROTOCOL_VERSION;

		private ToolsRepository toolsRepository;

		private ResourcesRepository resourcesRepository;

		private PromptsRepository promptsRepository;

		private final List<ToolSpecification> tools = new ArrayList<>();

		private final List<ResourceSpecification> resources = new ArrayList<>();

		private final List<PromptSpecification> prompts = new ArrayList<>();

		private final Map<String, McpRequestHandler> methods = new LinkedHashMap<>();

		private MethodRegistry.BeforeHook beforeHook;

		private MethodRegistry.AfterHook afterHook;

		private MethodRegistry.ErrorHook errorHook;

		private MethodRegistry.FallbackHook fallbackHook;

		private NotificationMode notificationMode = NotificationMode.SYNC;

		private Duration notificationPollInterval = NotificationDeliveryService.DEFAULT_POLL_INTERVAL;

		private Builder(McpServerTransportProvider transportProvider) {
			Assert.notNull(transportProvider, "transportProvider must not be null");
			this.transportProvider = transportProvider;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public Builder serverInfo(String name, String version) {
			Assert.hasText(name, "name must not be empty");
			Assert.hasText(version, "version must not be empty");
			this.serverInfo = new Implementation(name, version);
			return this;
		}

		public Builder serverInfo(Implementation serverInfo) {
			Assert.notNull(serverInfo, "serverInfo must not be null");
			this.serverInfo = serverInfo;
			return this;
		}

		public Builder capabilities(ServerCapabilities capabilities) {
			this.capabilities = capabilities;
			return this;
		}

		public Builder instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public Builder protocolVersion(String protocolVersion) {
			Assert.hasText(protocolVersion, "protocolVersion must not be empty");
			this.protocolVersion = protocolVersion;
			return this;
		}

		public Builder toolsRepository(ToolsRepository toolsRepository) {
			this.toolsRepository = toolsRepository;
			return this;
		}

		public Builder resourcesRepository(ResourcesRepository resourcesRepository) {
			this.resourcesRepository = resourcesRepository;
			return this;
		}

		public Builder promptsRepository(PromptsRepository promptsRepository) {
			this.promptsRepository = promptsRepository;
			return this;
		}

		public Builder tools(ToolSpecification... tools) {
			return tools(Arrays.asList(tools));
		}

		public Builder tools(List<ToolSpecification> tools) {
			Assert.notNull(tools, "tools must not be null");
			this.tools.addAll(tools);
			return this;
		}

		public Builder resources(ResourceSpecification... resources) {
			return resources(Arrays.asList(resources));
		}

		public Builder resources(List<ResourceSpecification> resources) {
			Assert.notNull(resources, "resources must not be null");
			this.resources.addAll(resources);
			return this;
		}

		public Builder prompts(PromptSpecification... prompts) {
			return prompts(Arrays.asList(prompts));
		}

		public Builder prompts(List<PromptSpecification> prompts) {
			Assert.notNull(prompts, "prompts must not be null");
			this.prompts.addAll(prompts);
			return this;
		}

		/**
		 * Registers a custom method. It replaces a built-in method of the same name.
		 * @param method method name
		 * @param handler the handler
		 * @return this builder
		 */
		public Builder method(String method, McpRequestHandler handler) {
			Assert.hasText(method, "method must not be empty");
			Assert.notNull(handler, "handler must not be null");
			this.methods.put(method, handler);
			return this;
		}

		public Builder onBefore(MethodRegistry.BeforeHook hook) {
			this.beforeHook = hook;
			return this;
		}

		public Builder onAfter(MethodRegistry.AfterHook hook) {
			this.afterHook = hook;
			return this;
		}

		public Builder onError(MethodRegistry.ErrorHook hook) {
			this.errorHook = hook;
			return this;
		}

		public Builder onFallback(MethodRegistry.FallbackHook hook) {
			this.fallbackHook = hook;
			return this;
		}

		public Builder notificationMode(NotificationMode notificationMode) {
			Assert.notNull(notificationMode, "notificationMode must not be null");
			this.notificationMode = notificationMode;
			return this;
		}

		public Builder notificationPollInterval(Duration notificationPollInterval) {
			Assert.notNull(notificationPollInterval, "notificationPollInterval must not be null");
			this.notificationPollInterval = notificationPollInterval;
			return this;
		}

		/**
		 * Builds the server and starts the transport provider.
		 * @return the running server
		 */
		public McpServer build() {
			return new McpServer(this);
		}

	}

}
