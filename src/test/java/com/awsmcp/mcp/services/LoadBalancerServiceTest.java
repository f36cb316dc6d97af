package com.awsmcp.mcp.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.awsmcp.mcp.api.InvalidArgumentException;
import com.awsmcp.mcp.api.ToolRegistry;
import com.awsmcp.mcp.model.StatusMessage;
import com.awsmcp.mcp.model.ToolResult;

import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ActionTypeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateListenerRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateListenerResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateLoadBalancerRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateLoadBalancerResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeleteLoadBalancerRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeleteLoadBalancerResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancersRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancersResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupsResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Listener;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancer;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancerTypeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ModifyListenerRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ModifyListenerResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ModifyLoadBalancerAttributesRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ModifyLoadBalancerAttributesResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RegisterTargetsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RegisterTargetsResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetGroup;

@ExtendWith(MockitoExtension.class)
class LoadBalancerServiceTest {

    @Mock
    private ElasticLoadBalancingV2Client elb;

    private LoadBalancerService service;

    @BeforeEach
    void setUp() {
        service = new LoadBalancerService(elb);
    }

    private static LoadBalancer loadBalancer(String name, LoadBalancerTypeEnum type) {
        return LoadBalancer.builder().loadBalancerName(name).type(type).build();
    }

    @Test
    @DisplayName("list_load_balancers drains by marker and keeps only network load balancers")
    void testListLoadBalancers_NetworkOnly() {
        when(elb.describeLoadBalancers(any(DescribeLoadBalancersRequest.class))).thenReturn(
            DescribeLoadBalancersResponse.builder()
                .loadBalancers(loadBalancer("nlb-a", LoadBalancerTypeEnum.NETWORK),
                    loadBalancer("alb-a", LoadBalancerTypeEnum.APPLICATION))
                .nextMarker("m2")
                .build(),
            DescribeLoadBalancersResponse.builder()
                .loadBalancers(loadBalancer("nlb-b", LoadBalancerTypeEnum.NETWORK))
                .build());

        List<?> result = (List<?>) assertInstanceOf(ToolResult.Success.class, service.listLoadBalancers()).payload();

        assertEquals(List.of("nlb-a", "nlb-b"),
            result.stream().map(lb -> ((Map<?, ?>) lb).get("LoadBalancerName")).toList());
        ArgumentCaptor<DescribeLoadBalancersRequest> captor = ArgumentCaptor.forClass(DescribeLoadBalancersRequest.class);
        verify(elb, times(2)).describeLoadBalancers(captor.capture());
        assertNull(captor.getAllValues().get(0).marker());
        assertEquals("m2", captor.getAllValues().get(1).marker());
    }

    @Test
    void testDescribeLoadBalancer_NotFound() {
        when(elb.describeLoadBalancers(any(DescribeLoadBalancersRequest.class)))
            .thenReturn(DescribeLoadBalancersResponse.builder().build());

        assertEquals(ToolResult.notFound("Load balancer arn:lb/x not found"), service.describeLoadBalancer("arn:lb/x"));
    }

    @Test
    void testCreateLoadBalancer_Defaults() {
        when(elb.createLoadBalancer(any(CreateLoadBalancerRequest.class))).thenReturn(CreateLoadBalancerResponse.builder()
            .loadBalancers(loadBalancer("web", LoadBalancerTypeEnum.NETWORK))
            .build());
        ToolRegistry registry = new ToolRegistry();
        registry.registerAnnotated(service);

        ToolResult result = registry.invoke("create_load_balancer",
            Map.of("name", "web", "subnets", List.of("subnet-1", "subnet-2")));

        assertEquals(ToolResult.success(List.of(Map.of("LoadBalancerName", "web", "Type", "network"))), result);
        ArgumentCaptor<CreateLoadBalancerRequest> captor = ArgumentCaptor.forClass(CreateLoadBalancerRequest.class);
        verify(elb).createLoadBalancer(captor.capture());
        CreateLoadBalancerRequest sent = captor.getValue();
        assertEquals("internet-facing", sent.schemeAsString());
        assertEquals("ipv4", sent.ipAddressTypeAsString());
        assertEquals("network", sent.typeAsString());
        assertEquals(List.of("subnet-1", "subnet-2"), sent.subnets());
    }

    @Test
    void testCreateLoadBalancer_TypeArgumentName() {
        when(elb.createLoadBalancer(any(CreateLoadBalancerRequest.class)))
            .thenReturn(CreateLoadBalancerResponse.builder().build());
        ToolRegistry registry = new ToolRegistry();
        registry.registerAnnotated(service);

        registry.invoke("create_load_balancer",
            Map.of("name", "gw", "subnets", List.of("subnet-1"), "type_", "gateway"));

        ArgumentCaptor<CreateLoadBalancerRequest> captor = ArgumentCaptor.forClass(CreateLoadBalancerRequest.class);
        verify(elb).createLoadBalancer(captor.capture());
        assertEquals("gateway", captor.getValue().typeAsString());
    }

    @Test
    void testDeleteLoadBalancer_Status() {
        when(elb.deleteLoadBalancer(any(DeleteLoadBalancerRequest.class)))
            .thenReturn(DeleteLoadBalancerResponse.builder().build());

        assertEquals(ToolResult.success(StatusMessage.of("Load balancer arn:lb/1 deletion initiated")),
            service.deleteLoadBalancer("arn:lb/1"));
    }

    @Test
    void testModifyLoadBalancerAttributes_PairsInOrder() {
        when(elb.modifyLoadBalancerAttributes(any(ModifyLoadBalancerAttributesRequest.class)))
            .thenReturn(ModifyLoadBalancerAttributesResponse.builder().build());
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("load_balancing.cross_zone.enabled", "true");
        attributes.put("deletion_protection.enabled", "false");

        service.modifyLoadBalancerAttributes("arn:lb/1", attributes);

        ArgumentCaptor<ModifyLoadBalancerAttributesRequest> captor =
            ArgumentCaptor.forClass(ModifyLoadBalancerAttributesRequest.class);
        verify(elb).modifyLoadBalancerAttributes(captor.capture());
        assertEquals(List.of("load_balancing.cross_zone.enabled", "deletion_protection.enabled"),
            captor.getValue().attributes().stream().map(a -> a.key()).toList());
    }

    @Test
    void testListTargetGroups_NetworkProtocolsOnly() {
        when(elb.describeTargetGroups(any(DescribeTargetGroupsRequest.class))).thenReturn(
            DescribeTargetGroupsResponse.builder().targetGroups(
                TargetGroup.builder().targetGroupName("tcp").protocol("TCP").build(),
                TargetGroup.builder().targetGroupName("http").protocol("HTTP").build(),
                TargetGroup.builder().targetGroupName("udp").protocol("UDP").build()).build());

        List<?> groups = (List<?>) assertInstanceOf(ToolResult.Success.class,
            service.listTargetGroups("arn:lb/1")).payload();

        assertEquals(List.of("tcp", "udp"), groups.stream().map(g -> ((Map<?, ?>) g).get("TargetGroupName")).toList());
        ArgumentCaptor<DescribeTargetGroupsRequest> captor = ArgumentCaptor.forClass(DescribeTargetGroupsRequest.class);
        verify(elb).describeTargetGroups(captor.capture());
        assertEquals("arn:lb/1", captor.getValue().loadBalancerArn());
    }

    @Test
    void testRegisterTargets_BuildsTargetDescriptions() {
        when(elb.registerTargets(any(RegisterTargetsRequest.class))).thenReturn(RegisterTargetsResponse.builder().build());

        ToolResult result = service.registerTargets("arn:tg/1",
            List.of(Map.of("Id", "i-1", "Port", 80), Map.of("Id", "10.0.0.5", "AvailabilityZone", "all")));

        assertEquals(ToolResult.success(StatusMessage.of("Targets registration initiated")), result);
        ArgumentCaptor<RegisterTargetsRequest> captor = ArgumentCaptor.forClass(RegisterTargetsRequest.class);
        verify(elb).registerTargets(captor.capture());
        assertEquals(Integer.valueOf(80), captor.getValue().targets().get(0).port());
        assertEquals("all", captor.getValue().targets().get(1).availabilityZone());
    }

    @Test
    void testRegisterTargets_UnknownFieldIsRejectedBeforeCall() {
        assertThrows(InvalidArgumentException.class,
            () -> service.registerTargets("arn:tg/1", List.of(Map.of("InstanceId", "i-1"))));

        ToolRegistry registry = new ToolRegistry();
        registry.registerAnnotated(service);
        ToolResult result = registry.invoke("register_targets",
            Map.of("target_group_arn", "arn:tg/1", "targets", List.of(Map.of("InstanceId", "i-1"))));

        assertEquals(ToolResult.validationError("Argument 'targets' has unknown field 'InstanceId'"), result);
        verify(elb, never()).registerTargets(any(RegisterTargetsRequest.class));
    }

    @Test
    void testCreateListener_ForwardAction() {
        when(elb.createListener(any(CreateListenerRequest.class))).thenReturn(CreateListenerResponse.builder()
            .listeners(Listener.builder().listenerArn("arn:listener/1").port(443).build())
            .build());

        ToolResult result = service.createListener("arn:lb/1", "TLS", 443,
            List.of(Map.of("Type", "forward", "TargetGroupArn", "arn:tg/1")));

        assertEquals(ToolResult.success(List.of(Map.of("ListenerArn", "arn:listener/1", "Port", 443))), result);
        ArgumentCaptor<CreateListenerRequest> captor = ArgumentCaptor.forClass(CreateListenerRequest.class);
        verify(elb).createListener(captor.capture());
        assertEquals(ActionTypeEnum.FORWARD, captor.getValue().defaultActions().get(0).type());
        assertEquals("arn:tg/1", captor.getValue().defaultActions().get(0).targetGroupArn());
    }

    @Test
    void testModifyListener_OnlyPresentArguments() {
        when(elb.modifyListener(any(ModifyListenerRequest.class))).thenReturn(ModifyListenerResponse.builder().build());

        service.modifyListener("arn:listener/1", null, 8443, null);

        ArgumentCaptor<ModifyListenerRequest> captor = ArgumentCaptor.forClass(ModifyListenerRequest.class);
        verify(elb).modifyListener(captor.capture());
        assertEquals(Integer.valueOf(8443), captor.getValue().port());
        assertNull(captor.getValue().protocolAsString());
        assertTrue(captor.getValue().defaultActions().isEmpty());
    }
}
