package com.awsmcp.mcp.services;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.awsmcp.mcp.api.McpTool;
import com.awsmcp.mcp.api.Param;
import com.awsmcp.mcp.api.RequestParams;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.provider.PageDrain;
import com.awsmcp.mcp.provider.ProviderCall;
import com.awsmcp.mcp.utils.SdkPojos;

import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateListenerRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateListenerResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateLoadBalancerRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateLoadBalancerResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateTargetGroupRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateTargetGroupResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeleteListenerRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeleteLoadBalancerRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeleteTargetGroupRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeregisterTargetsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeListenersRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeListenersResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancersRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancersResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupsResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancerAttribute;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancerTypeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ModifyListenerRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ModifyListenerResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ModifyLoadBalancerAttributesRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ModifyLoadBalancerAttributesResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RegisterTargetsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetDescription;

/**
 * Network load balancer, target group and listener tools of the aws-nlb server.
 * Structured arguments (targets, actions) use the provider's member names, e.g. {@code {"Id": "i-1", "Port": 80}}.
 */
public class LoadBalancerService {
    /** Target group protocols a network load balancer can route to. */
    static final Set<String> NETWORK_PROTOCOLS = Set.of("TCP", "TLS", "UDP", "TCP_UDP");

    private final ElasticLoadBalancingV2Client elb;

    public LoadBalancerService(ElasticLoadBalancingV2Client elb) {
        this.elb = elb;
    }

    @McpTool(description = "List network load balancers.")
    public ToolResult listLoadBalancers() {
        return ProviderCall.of(() -> PageDrain.drain(
                marker -> elb.describeLoadBalancers(DescribeLoadBalancersRequest.builder().marker(marker).build()),
                DescribeLoadBalancersResponse::loadBalancers,
                DescribeLoadBalancersResponse::nextMarker))
            .respond(loadBalancers -> loadBalancers.stream()
                .filter(lb -> lb.type() == LoadBalancerTypeEnum.NETWORK)
                .toList());
    }

    @McpTool(description = "Describe a specific load balancer.")
    public ToolResult describeLoadBalancer(@Param("Load balancer ARN") String loadBalancerArn) {
        DescribeLoadBalancersRequest request = DescribeLoadBalancersRequest.builder()
            .loadBalancerArns(loadBalancerArn)
            .build();
        return ProviderCall.of(() -> elb.describeLoadBalancers(request))
            .respondFirst(DescribeLoadBalancersResponse::loadBalancers,
                "Load balancer " + loadBalancerArn + " not found");
    }

    @McpTool(description = "Create a network load balancer.")
    public ToolResult createLoadBalancer(
            @Param("Load balancer name") String name,
            @Param("Subnet IDs to attach") List<String> subnets,
            @Param(value = "internet-facing or internal", defaultValue = "internet-facing") String scheme,
            @Param(value = "ipv4 or dualstack", defaultValue = "ipv4") String ipAddressType,
            @Param(value = "Load balancer type", defaultValue = "network", name = "type_") String type) {
        CreateLoadBalancerRequest request = CreateLoadBalancerRequest.builder()
            .name(name)
            .subnets(subnets)
            .scheme(scheme)
            .ipAddressType(ipAddressType)
            .type(type)
            .build();
        return ProviderCall.of(() -> elb.createLoadBalancer(request))
            .respond(CreateLoadBalancerResponse::loadBalancers);
    }

    @McpTool(description = "Delete a load balancer.")
    public ToolResult deleteLoadBalancer(@Param("Load balancer ARN") String loadBalancerArn) {
        DeleteLoadBalancerRequest request = DeleteLoadBalancerRequest.builder()
            .loadBalancerArn(loadBalancerArn)
            .build();
        return ProviderCall.of(() -> elb.deleteLoadBalancer(request))
            .respondStatus("Load balancer " + loadBalancerArn + " deletion initiated");
    }

    @McpTool(description = "Modify load balancer attributes.")
    public ToolResult modifyLoadBalancerAttributes(
            @Param("Load balancer ARN") String loadBalancerArn,
            @Param("Attributes as a key/value mapping, e.g. load_balancing.cross_zone.enabled") Map<String, String> attributes) {
        ModifyLoadBalancerAttributesRequest request = ModifyLoadBalancerAttributesRequest.builder()
            .loadBalancerArn(loadBalancerArn)
            .attributes(RequestParams.keyValuePairs(attributes,
                (key, value) -> LoadBalancerAttribute.builder().key(key).value(value).build()))
            .build();
        return ProviderCall.of(() -> elb.modifyLoadBalancerAttributes(request))
            .respond(ModifyLoadBalancerAttributesResponse::attributes);
    }

    @McpTool(description = "List target groups, optionally filtered by load balancer.")
    public ToolResult listTargetGroups(
            @Param(value = "Load balancer ARN to filter on", defaultValue = "") String loadBalancerArn) {
        DescribeTargetGroupsRequest.Builder request = DescribeTargetGroupsRequest.builder();
        RequestParams.ifPresent(loadBalancerArn, request::loadBalancerArn);
        DescribeTargetGroupsRequest firstPage = request.build();

        return ProviderCall.of(() -> PageDrain.drain(
                marker -> elb.describeTargetGroups(firstPage.toBuilder().marker(marker).build()),
                DescribeTargetGroupsResponse::targetGroups,
                DescribeTargetGroupsResponse::nextMarker))
            .respond(targetGroups -> targetGroups.stream()
                .filter(tg -> NETWORK_PROTOCOLS.contains(tg.protocolAsString()))
                .toList());
    }

    @McpTool(description = "Create a target group for a network load balancer.")
    public ToolResult createTargetGroup(
            @Param("Target group name") String name,
            @Param("TCP, TLS, UDP or TCP_UDP") String protocol,
            @Param("Port the targets receive traffic on") int port,
            @Param("VPC ID") String vpcId,
            @Param(value = "instance, ip or alb", defaultValue = "instance") String targetType,
            @Param(value = "Health check protocol", defaultValue = "") String healthCheckProtocol,
            @Param(value = "Health check port", defaultValue = "") String healthCheckPort) {
        CreateTargetGroupRequest.Builder request = CreateTargetGroupRequest.builder()
            .name(name)
            .protocol(protocol)
            .port(port)
            .vpcId(vpcId)
            .targetType(targetType);
        RequestParams.ifPresent(healthCheckProtocol, request::healthCheckProtocol);
        RequestParams.ifPresent(healthCheckPort, request::healthCheckPort);

        CreateTargetGroupRequest built = request.build();
        return ProviderCall.of(() -> elb.createTargetGroup(built))
            .respond(CreateTargetGroupResponse::targetGroups);
    }

    @McpTool(description = "Delete a target group.")
    public ToolResult deleteTargetGroup(@Param("Target group ARN") String targetGroupArn) {
        DeleteTargetGroupRequest request = DeleteTargetGroupRequest.builder()
            .targetGroupArn(targetGroupArn)
            .build();
        return ProviderCall.of(() -> elb.deleteTargetGroup(request))
            .respondStatus("Target group " + targetGroupArn + " deletion initiated");
    }

    @McpTool(description = "Register targets with a target group.")
    public ToolResult registerTargets(
            @Param("Target group ARN") String targetGroupArn,
            @Param("Targets, e.g. [{\"Id\": \"i-123\", \"Port\": 80}]") List<Map<String, Object>> targets) {
        RegisterTargetsRequest request = RegisterTargetsRequest.builder()
            .targetGroupArn(targetGroupArn)
            .targets(SdkPojos.fromMaps("targets", targets, TargetDescription::builder))
            .build();
        return ProviderCall.of(() -> elb.registerTargets(request))
            .respondStatus("Targets registration initiated");
    }

    @McpTool(description = "Deregister targets from a target group.")
    public ToolResult deregisterTargets(
            @Param("Target group ARN") String targetGroupArn,
            @Param("Targets, e.g. [{\"Id\": \"i-123\"}]") List<Map<String, Object>> targets) {
        DeregisterTargetsRequest request = DeregisterTargetsRequest.builder()
            .targetGroupArn(targetGroupArn)
            .targets(SdkPojos.fromMaps("targets", targets, TargetDescription::builder))
            .build();
        return ProviderCall.of(() -> elb.deregisterTargets(request))
            .respondStatus("Targets deregistration initiated");
    }

    @McpTool(description = "List listeners of a load balancer.")
    public ToolResult listListeners(@Param("Load balancer ARN") String loadBalancerArn) {
        DescribeListenersRequest firstPage = DescribeListenersRequest.builder()
            .loadBalancerArn(loadBalancerArn)
            .build();
        return ProviderCall.of(() -> PageDrain.drain(
                marker -> elb.describeListeners(firstPage.toBuilder().marker(marker).build()),
                DescribeListenersResponse::listeners,
                DescribeListenersResponse::nextMarker))
            .respond(listeners -> listeners);
    }

    @McpTool(description = "Create a listener on a load balancer.")
    public ToolResult createListener(
            @Param("Load balancer ARN") String loadBalancerArn,
            @Param("Listener protocol") String protocol,
            @Param("Listener port") int port,
            @Param("Default actions, e.g. [{\"Type\": \"forward\", \"TargetGroupArn\": \"arn:...\"}]") List<Map<String, Object>> defaultActions) {
        CreateListenerRequest request = CreateListenerRequest.builder()
            .loadBalancerArn(loadBalancerArn)
            .protocol(protocol)
            .port(port)
            .defaultActions(SdkPojos.fromMaps("default_actions", defaultActions, Action::builder))
            .build();
        return ProviderCall.of(() -> elb.createListener(request))
            .respond(CreateListenerResponse::listeners);
    }

    @McpTool(description = "Delete a listener.")
    public ToolResult deleteListener(@Param("Listener ARN") String listenerArn) {
        DeleteListenerRequest request = DeleteListenerRequest.builder().listenerArn(listenerArn).build();
        return ProviderCall.of(() -> elb.deleteListener(request))
            .respondStatus("Listener " + listenerArn + " deletion initiated");
    }

    @McpTool(description = "Modify a listener's actions, port or protocol.")
    public ToolResult modifyListener(
            @Param("Listener ARN") String listenerArn,
            @Param(value = "Replacement default actions", defaultValue = "") List<Map<String, Object>> defaultActions,
            @Param(value = "New port", defaultValue = "") Integer port,
            @Param(value = "New protocol", defaultValue = "") String protocol) {
        ModifyListenerRequest.Builder request = ModifyListenerRequest.builder().listenerArn(listenerArn);
        RequestParams.composite(defaultActions,
            actions -> SdkPojos.fromMaps("default_actions", actions, Action::builder),
            request::defaultActions);
        RequestParams.ifPresent(port, request::port);
        RequestParams.ifPresent(protocol, request::protocol);

        ModifyListenerRequest built = request.build();
        return ProviderCall.of(() -> elb.modifyListener(built))
            .respond(ModifyListenerResponse::listeners);
    }
}
