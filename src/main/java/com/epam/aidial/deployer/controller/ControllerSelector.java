package com.epam.aidial.deployer.controller;

import com.epam.aidial.deployer.ApiContext;
import com.epam.aidial.deployer.DeployerApi;
import com.epam.aidial.deployer.util.HttpStatus;
import com.epam.aidial.deployer.util.UrlUtil;
import io.vertx.core.http.HttpMethod;
import lombok.experimental.UtilityClass;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class ControllerSelector {

    private static final Pattern DEPLOYMENTS = Pattern.compile("^/+v1/deployments$");
    private static final Pattern DEPLOYMENT = Pattern.compile("^/+v1/deployments/(?<id>[^/]+)$");
    private static final Pattern DEPLOYMENT_CANCEL = Pattern.compile("^/+v1/deployments/(?<id>[^/]+)/cancel$");
    private static final Pattern DEPLOYMENT_LOGS = Pattern.compile("^/+v1/deployments/(?<id>[^/]+)/logs$");
    private static final Pattern DEPLOYMENT_EVENTS = Pattern.compile("^/+v1/deployments/(?<id>[^/]+)/events$");
    private static final Pattern SESSIONS = Pattern.compile("^/+v1/deployments/(?<id>[^/]+)/sessions$");
    private static final Pattern SESSION = Pattern.compile("^/+v1/deployments/(?<id>[^/]+)/sessions/(?<session>[^/]+)$");
    private static final Pattern SESSION_EVENTS = Pattern.compile("^/+v1/deployments/(?<id>[^/]+)/sessions/(?<session>[^/]+)/events$");

    private static final Pattern CONFIG_SET = Pattern.compile("^/+v1/config-sets/(?<id>[^/]+)$");
    private static final Pattern FILES = Pattern.compile("^/+v1/config-sets/(?<id>[^/]+)/files$");
    private static final Pattern FILE_REVISIONS = Pattern.compile("^/+v1/config-sets/(?<id>[^/]+)/files/(?<name>.+)/revisions$");
    private static final Pattern FILE = Pattern.compile("^/+v1/config-sets/(?<id>[^/]+)/files/(?<name>.+)$");

    public Controller select(DeployerApi api, ApiContext context) {
        String path = context.getRequest().path();
        HttpMethod method = context.getRequest().method();
        Controller controller = null;

        if (method == HttpMethod.GET) {
            controller = selectGet(api, context, path);
        } else if (method == HttpMethod.POST) {
            controller = selectPost(api, context, path);
        } else if (method == HttpMethod.DELETE) {
            controller = selectDelete(api, context, path);
        } else if (method == HttpMethod.PUT) {
            controller = selectPut(api, context, path);
        }

        return (controller == null) ? () -> context.respond(HttpStatus.NOT_FOUND, "Route is not found: " + path) : controller;
    }

    private static Controller selectGet(DeployerApi api, ApiContext context, String path) {
        Matcher match;

        match = match(DEPLOYMENTS, path);
        if (match != null) {
            DeploymentController controller = new DeploymentController(api, context);
            return controller::getDeployments;
        }

        match = match(DEPLOYMENT, path);
        if (match != null) {
            DeploymentController controller = new DeploymentController(api, context);
            String deploymentId = UrlUtil.decodePath(match.group("id"));
            return () -> controller.getDeployment(deploymentId);
        }

        match = match(DEPLOYMENT_LOGS, path);
        if (match != null) {
            DeploymentController controller = new DeploymentController(api, context);
            String deploymentId = UrlUtil.decodePath(match.group("id"));
            return () -> controller.getLogs(deploymentId);
        }

        match = match(DEPLOYMENT_EVENTS, path);
        if (match != null) {
            ProgressController controller = new ProgressController(api, context);
            String deploymentId = UrlUtil.decodePath(match.group("id"));
            return () -> controller.subscribeDeployment(deploymentId);
        }

        match = match(SESSIONS, path);
        if (match != null) {
            DeploymentController controller = new DeploymentController(api, context);
            String deploymentId = UrlUtil.decodePath(match.group("id"));
            return () -> controller.getSessions(deploymentId);
        }

        match = match(SESSION, path);
        if (match != null) {
            DeploymentController controller = new DeploymentController(api, context);
            String deploymentId = UrlUtil.decodePath(match.group("id"));
            String sessionId = UrlUtil.decodePath(match.group("session"));
            return () -> controller.getSession(deploymentId, sessionId);
        }

        match = match(SESSION_EVENTS, path);
        if (match != null) {
            ProgressController controller = new ProgressController(api, context);
            String deploymentId = UrlUtil.decodePath(match.group("id"));
            String sessionId = UrlUtil.decodePath(match.group("session"));
            return () -> controller.subscribeSession(deploymentId, sessionId);
        }

        match = match(CONFIG_SET, path);
        if (match != null) {
            ConfigSetController controller = new ConfigSetController(api, context);
            String configSetId = UrlUtil.decodePath(match.group("id"));
            return () -> controller.getConfigSet(configSetId);
        }

        match = match(FILES, path);
        if (match != null) {
            ConfigSetController controller = new ConfigSetController(api, context);
            String configSetId = UrlUtil.decodePath(match.group("id"));
            return () -> controller.getFiles(configSetId);
        }

        match = match(FILE_REVISIONS, path);
        if (match != null) {
            ConfigSetController controller = new ConfigSetController(api, context);
            String configSetId = UrlUtil.decodePath(match.group("id"));
            String fileName = UrlUtil.decodePath(match.group("name"));
            return () -> controller.getRevisions(configSetId, fileName);
        }

        match = match(FILE, path);
        if (match != null) {
            ConfigSetController controller = new ConfigSetController(api, context);
            String configSetId = UrlUtil.decodePath(match.group("id"));
            String fileName = UrlUtil.decodePath(match.group("name"));
            return () -> controller.getFile(configSetId, fileName);
        }

        return null;
    }

    private static Controller selectPost(DeployerApi api, ApiContext context, String path) {
        Matcher match;

        match = match(DEPLOYMENTS, path);
        if (match != null) {
            DeploymentController controller = new DeploymentController(api, context);
            return controller::createDeployment;
        }

        match = match(DEPLOYMENT_CANCEL, path);
        if (match != null) {
            DeploymentController controller = new DeploymentController(api, context);
            String deploymentId = UrlUtil.decodePath(match.group("id"));
            return () -> controller.cancelDeployment(deploymentId);
        }

        return null;
    }

    private static Controller selectDelete(DeployerApi api, ApiContext context, String path) {
        Matcher match = match(DEPLOYMENT, path);
        if (match != null) {
            DeploymentController controller = new DeploymentController(api, context);
            String deploymentId = UrlUtil.decodePath(match.group("id"));
            return () -> controller.deleteDeployment(deploymentId);
        }

        return null;
    }

    private static Controller selectPut(DeployerApi api, ApiContext context, String path) {
        Matcher match;

        match = match(CONFIG_SET, path);
        if (match != null) {
            ConfigSetController controller = new ConfigSetController(api, context);
            String configSetId = UrlUtil.decodePath(match.group("id"));
            return () -> controller.putConfigSet(configSetId);
        }

        match = match(FILE, path);
        if (match != null) {
            ConfigSetController controller = new ConfigSetController(api, context);
            String configSetId = UrlUtil.decodePath(match.group("id"));
            String fileName = UrlUtil.decodePath(match.group("name"));
            return () -> controller.putFile(configSetId, fileName);
        }

        return null;
    }

    private Matcher match(Pattern pattern, String path) {
        Matcher matcher = pattern.matcher(path);
        return matcher.find() ? matcher : null;
    }
}
