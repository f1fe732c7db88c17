package com.piacp.gateway.rpc;

/**
 * ACP method names, and the router carrying the bridge's method surface.
 */
public final class AcpMethods {

    public static final String INITIALIZE = "initialize";
    public static final String INITIALIZED = "initialized";
    public static final String SESSION_NEW = "session/new";
    public static final String SESSION_LOAD = "session/load";
    public static final String SESSION_RESUME = "session/resume";
    public static final String SESSION_LIST = "session/list";
    public static final String SESSION_CANCEL = "session/cancel";
    public static final String SESSION_PROMPT = "session/prompt";
    public static final String SESSION_UPDATE = "session/update";
    public static final String TOOL_REQUEST_APPROVAL = "item/tool/requestApproval";
    public static final String TOOL_REQUEST_USER_INPUT = "item/tool/requestUserInput";
    public static final String GENUI_ACTION = "genui/action";

    private AcpMethods() {
    }

    public static AcpMethodRouter createRouter() {
        AcpMethodRouter router = new AcpMethodRouter();
        router.registerMethod(INITIALIZE, (params, agent) -> agent.initialize(params));
        router.registerNotification(INITIALIZED, (params, agent) -> {
        });
        router.registerMethod(SESSION_NEW, (params, agent) -> agent.newSession(params));
        router.registerMethod(SESSION_LOAD, (params, agent) -> agent.loadSession(params));
        router.registerMethod(SESSION_RESUME, (params, agent) -> agent.resumeSession(params));
        router.registerMethod(SESSION_LIST, (params, agent) -> agent.listSessions(params));
        router.registerNotification(SESSION_CANCEL, (params, agent) -> agent.cancel(params));
        router.registerMethod(TOOL_REQUEST_APPROVAL, (params, agent) -> agent.requestApproval(params));
        router.registerMethod(TOOL_REQUEST_USER_INPUT, (params, agent) -> agent.requestUserInput(params));

        // a turn runs until pi finishes; cancel and approvals must get through meanwhile
        router.registerDetachedMethod(SESSION_PROMPT, (params, agent) -> agent.prompt(params));
        router.registerDetachedMethod(GENUI_ACTION, (params, agent) -> agent.genuiAction(params));
        return router;
    }
}
