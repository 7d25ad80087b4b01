package com.bizflow.process.core.engine;

import com.bizflow.process.core.engine.config.BizFlowRuntimeConfig;
import com.bizflow.process.core.engine.definition.ProcessDefinitionLoader;
import com.bizflow.process.core.engine.expression.BranchConditionEvaluator;
import com.bizflow.process.core.engine.lock.IBizFlowInstanceLockService;
import com.bizflow.process.core.engine.lock.impl.InMemoryInstanceLockService;
import com.bizflow.process.core.engine.registry.ProcessDefinitionRegistry;
import com.bizflow.process.core.engine.registry.ProcessDefinitionRegistryHolder;
import com.bizflow.process.core.engine.runtime.ProcessInstanceRuntime;
import com.bizflow.process.core.engine.service.BizFlowProcessRuntimeService;
import com.bizflow.process.core.engine.sideeffect.BizFlowSideEffectDispatcher;
import com.bizflow.process.core.engine.sideeffect.SideEffectWarningRecorder;
import com.bizflow.process.core.engine.sideeffect.impl.LoggingSideEffectHandler;
import com.bizflow.process.core.engine.sideeffect.impl.StateStoreSideEffectHandler;
import com.bizflow.process.core.engine.state.IBizFlowProcessStateStore;
import com.bizflow.process.core.engine.state.impl.InMemoryProcessStateStore;
import com.bizflow.process.core.engine.suspension.ProcessSuspensionManager;
import com.bizflow.process.core.engine.validation.ProcessDefinitionValidator;
import com.bizflow.process.integration.contract.IBizFlowProcessRuntimeService;
import com.bizflow.process.integration.contract.sideeffect.IBizFlowSideEffectHandler;
import com.bizflow.process.integration.models.source.ProcessDocumentSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires the runtime components together.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BizFlowProcessEngine engine = BizFlowProcessEngine.create(BizFlowRuntimeConfig.fromSystemProperties());
 * engine.loadDefinitions("classpath:definitions/order-approval.yml");
 * engine.getRuntimeService().startInstance(BizFlowStartRequest.of("OrderApproval")).block();
 * }</pre>
 *
 * <p>The state store and the logging handler are registered as side-effect handlers; further
 * handlers can be added with {@link #registerHandler}. When the configuration names a definition
 * location it is loaded on creation.</p>
 */
@Slf4j
@Getter
public class BizFlowProcessEngine {

    private final BizFlowRuntimeConfig config;
    private final ProcessDefinitionValidator validator;
    private final ProcessDefinitionRegistryHolder registryHolder;
    private final ProcessDefinitionLoader definitionLoader;
    private final IBizFlowInstanceLockService lockService;
    private final IBizFlowProcessStateStore stateStore;
    private final SideEffectWarningRecorder warningRecorder;
    private final BizFlowSideEffectDispatcher sideEffectDispatcher;
    private final ProcessInstanceRuntime runtime;
    private final ProcessSuspensionManager suspensionManager;
    private final IBizFlowProcessRuntimeService runtimeService;

    private BizFlowProcessEngine(BizFlowRuntimeConfig config, IBizFlowInstanceLockService lockService,
                                 IBizFlowProcessStateStore stateStore) {
        config.validate();
        BranchConditionEvaluator conditionEvaluator = new BranchConditionEvaluator();
        this.config = config;
        this.validator = new ProcessDefinitionValidator(ProcessDefinitionValidator.defaultChecks(conditionEvaluator));
        this.registryHolder = new ProcessDefinitionRegistryHolder(validator);
        this.definitionLoader = new ProcessDefinitionLoader(registryHolder);
        this.lockService = lockService;
        this.stateStore = stateStore;
        this.warningRecorder = new SideEffectWarningRecorder();
        this.sideEffectDispatcher = new BizFlowSideEffectDispatcher(warningRecorder)
                .register(new StateStoreSideEffectHandler(stateStore))
                .register(new LoggingSideEffectHandler());
        this.runtime = new ProcessInstanceRuntime(registryHolder, conditionEvaluator, lockService,
                sideEffectDispatcher, warningRecorder, config);
        this.suspensionManager = new ProcessSuspensionManager(runtime);
        this.runtimeService = new BizFlowProcessRuntimeService(runtime, suspensionManager);

        if (config.getDefinitionLocation() != null) {
            definitionLoader.load(config.getDefinitionLocation());
        }
        log.info("Process engine created: {}", config);
    }

    public static BizFlowProcessEngine create() {
        return create(BizFlowRuntimeConfig.defaultConfig());
    }

    public static BizFlowProcessEngine create(BizFlowRuntimeConfig config) {
        return new BizFlowProcessEngine(config, new InMemoryInstanceLockService(), new InMemoryProcessStateStore());
    }

    public static BizFlowProcessEngine create(BizFlowRuntimeConfig config, IBizFlowInstanceLockService lockService,
                                              IBizFlowProcessStateStore stateStore) {
        return new BizFlowProcessEngine(config, lockService, stateStore);
    }

    public ProcessDefinitionRegistry loadDefinitions(String location) {
        return definitionLoader.load(location);
    }

    public ProcessDefinitionRegistry reloadDefinitions(ProcessDocumentSource document) {
        return registryHolder.reload(document);
    }

    public BizFlowProcessEngine registerHandler(IBizFlowSideEffectHandler handler) {
        sideEffectDispatcher.register(handler);
        return this;
    }
}
