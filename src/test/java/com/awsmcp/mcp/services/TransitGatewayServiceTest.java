package com.awsmcp.mcp.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.awsmcp.mcp.api.ToolRegistry;
import com.awsmcp.mcp.model.ToolResult;

import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRequest;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayResponse;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRouteRequest;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRouteResponse;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRouteTableRequest;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRouteTableResponse;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayVpcAttachmentRequest;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayVpcAttachmentResponse;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayAttachmentsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayAttachmentsResponse;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayRouteTablesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayRouteTablesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewaysResponse;
import software.amazon.awssdk.services.ec2.model.ModifyTransitGatewayRequest;
import software.amazon.awssdk.services.ec2.model.ModifyTransitGatewayResponse;
import software.amazon.awssdk.services.ec2.model.TransitGateway;
import software.amazon.awssdk.services.ec2.model.TransitGatewayAttachment;
import software.amazon.awssdk.services.ec2.model.TransitGatewayRoute;
import software.amazon.awssdk.services.ec2.model.TransitGatewayRouteTable;
import software.amazon.awssdk.services.ec2.model.TransitGatewayVpcAttachment;

@ExtendWith(MockitoExtension.class)
class TransitGatewayServiceTest {

    @Mock
    private Ec2Client ec2;

    private TransitGatewayService service;

    @BeforeEach
    void setUp() {
        service = new TransitGatewayService(ec2);
    }

    @Test
    void testListTransitGateways_DrainsPages() {
        when(ec2.describeTransitGateways(any(DescribeTransitGatewaysRequest.class))).thenReturn(
            DescribeTransitGatewaysResponse.builder()
                .transitGateways(TransitGateway.builder().transitGatewayId("tgw-1").build())
                .nextToken("n2")
                .build(),
            DescribeTransitGatewaysResponse.builder()
                .transitGateways(TransitGateway.builder().transitGatewayId("tgw-2").build())
                .build());

        assertEquals(ToolResult.success(List.of(Map.of("TransitGatewayId", "tgw-1"), Map.of("TransitGatewayId", "tgw-2"))),
            service.listTransitGateways());
        verify(ec2, times(2)).describeTransitGateways(any(DescribeTransitGatewaysRequest.class));
    }

    @Test
    void testDescribeTransitGateway_NotFound() {
        when(ec2.describeTransitGateways(any(DescribeTransitGatewaysRequest.class)))
            .thenReturn(DescribeTransitGatewaysResponse.builder().build());

        assertEquals(ToolResult.notFound("Transit gateway tgw-0 not found"), service.describeTransitGateway("tgw-0"));
    }

    @Test
    @DisplayName("create_transit_gateway sends no options block when no option is given")
    void testCreateTransitGateway_NoOptions() {
        when(ec2.createTransitGateway(any(CreateTransitGatewayRequest.class))).thenReturn(
            CreateTransitGatewayResponse.builder()
                .transitGateway(TransitGateway.builder().transitGatewayId("tgw-9").state("pending").build())
                .build());

        ToolResult result = service.createTransitGateway("core", null, null, null, null, null, null);

        assertEquals(ToolResult.success(Map.of("TransitGatewayId", "tgw-9", "State", "pending")), result);
        ArgumentCaptor<CreateTransitGatewayRequest> captor = ArgumentCaptor.forClass(CreateTransitGatewayRequest.class);
        verify(ec2).createTransitGateway(captor.capture());
        assertEquals("core", captor.getValue().description());
        assertNull(captor.getValue().options());
    }

    @Test
    void testCreateTransitGateway_OnlyPresentOptions() {
        when(ec2.createTransitGateway(any(CreateTransitGatewayRequest.class)))
            .thenReturn(CreateTransitGatewayResponse.builder().build());

        service.createTransitGateway(null, 64512L, null, "disable", null, "enable", null);

        ArgumentCaptor<CreateTransitGatewayRequest> captor = ArgumentCaptor.forClass(CreateTransitGatewayRequest.class);
        verify(ec2).createTransitGateway(captor.capture());
        CreateTransitGatewayRequest sent = captor.getValue();
        assertNull(sent.description());
        assertEquals(Long.valueOf(64512L), sent.options().amazonSideAsn());
        assertEquals("disable", sent.options().defaultRouteTableAssociationAsString());
        assertEquals("enable", sent.options().dnsSupportAsString());
        assertNull(sent.options().vpnEcmpSupportAsString());
    }

    @Test
    void testModifyTransitGateway_AmazonSideAsn() {
        when(ec2.modifyTransitGateway(any(ModifyTransitGatewayRequest.class)))
            .thenReturn(ModifyTransitGatewayResponse.builder().build());

        service.modifyTransitGateway("tgw-1", 65000L, null, null, null, null, null, null);

        ArgumentCaptor<ModifyTransitGatewayRequest> captor = ArgumentCaptor.forClass(ModifyTransitGatewayRequest.class);
        verify(ec2).modifyTransitGateway(captor.capture());
        assertEquals("tgw-1", captor.getValue().transitGatewayId());
        assertEquals(Long.valueOf(65000L), captor.getValue().options().amazonSideAsn());
    }

    @Test
    void testListAttachments_FiltersByTransitGateway() {
        when(ec2.describeTransitGatewayAttachments(any(DescribeTransitGatewayAttachmentsRequest.class))).thenReturn(
            DescribeTransitGatewayAttachmentsResponse.builder()
                .transitGatewayAttachments(TransitGatewayAttachment.builder().transitGatewayAttachmentId("tgw-attach-1").build())
                .build());

        service.listTransitGatewayAttachments("tgw-1", null);

        ArgumentCaptor<DescribeTransitGatewayAttachmentsRequest> captor =
            ArgumentCaptor.forClass(DescribeTransitGatewayAttachmentsRequest.class);
        verify(ec2).describeTransitGatewayAttachments(captor.capture());
        assertEquals("transit-gateway-id", captor.getValue().filters().get(0).name());
        assertEquals(List.of("tgw-1"), captor.getValue().filters().get(0).values());
        assertTrue(captor.getValue().transitGatewayAttachmentIds().isEmpty());
    }

    @Test
    @DisplayName("create_vpc_attachment builds options and attachment tags")
    void testCreateVpcAttachment_OptionsAndTags() {
        when(ec2.createTransitGatewayVpcAttachment(any(CreateTransitGatewayVpcAttachmentRequest.class))).thenReturn(
            CreateTransitGatewayVpcAttachmentResponse.builder()
                .transitGatewayVpcAttachment(TransitGatewayVpcAttachment.builder()
                    .transitGatewayAttachmentId("tgw-attach-7")
                    .build())
                .build());

        ToolResult result = service.createVpcAttachment("tgw-1", "vpc-1", List.of("subnet-a", "subnet-b"),
            Map.of("DnsSupport", "enable", "ApplianceModeSupport", "disable"), Map.of("Name", "prod"));

        assertEquals(ToolResult.success(Map.of("TransitGatewayAttachmentId", "tgw-attach-7")), result);
        ArgumentCaptor<CreateTransitGatewayVpcAttachmentRequest> captor =
            ArgumentCaptor.forClass(CreateTransitGatewayVpcAttachmentRequest.class);
        verify(ec2).createTransitGatewayVpcAttachment(captor.capture());
        CreateTransitGatewayVpcAttachmentRequest sent = captor.getValue();
        assertEquals("enable", sent.options().dnsSupportAsString());
        assertEquals("disable", sent.options().applianceModeSupportAsString());
        assertEquals("transit-gateway-attachment", sent.tagSpecifications().get(0).resourceTypeAsString());
        assertEquals("prod", sent.tagSpecifications().get(0).tags().get(0).value());
    }

    @Test
    void testCreateVpcAttachment_EmptyOptionsAndTagsAreOmitted() {
        when(ec2.createTransitGatewayVpcAttachment(any(CreateTransitGatewayVpcAttachmentRequest.class)))
            .thenReturn(CreateTransitGatewayVpcAttachmentResponse.builder().build());

        service.createVpcAttachment("tgw-1", "vpc-1", List.of("subnet-a"), Map.of(), Map.of());

        ArgumentCaptor<CreateTransitGatewayVpcAttachmentRequest> captor =
            ArgumentCaptor.forClass(CreateTransitGatewayVpcAttachmentRequest.class);
        verify(ec2).createTransitGatewayVpcAttachment(captor.capture());
        assertNull(captor.getValue().options());
        assertTrue(captor.getValue().tagSpecifications().isEmpty());
    }

    @Test
    void testCreateVpcAttachment_UnknownOptionIsValidationError() {
        ToolRegistry registry = new ToolRegistry();
        registry.registerAnnotated(service);

        ToolResult result = registry.invoke("create_vpc_attachment", Map.of(
            "transit_gateway_id", "tgw-1", "vpc_id", "vpc-1", "subnet_ids", List.of("subnet-a"),
            "options", Map.of("dns_support", "enable")));

        assertEquals(ToolResult.validationError("Argument 'options' has unknown field 'dns_support'"), result);
        verify(ec2, never()).createTransitGatewayVpcAttachment(any(CreateTransitGatewayVpcAttachmentRequest.class));
    }

    @Test
    void testListRouteTables_NoFilterWithoutId() {
        when(ec2.describeTransitGatewayRouteTables(any(DescribeTransitGatewayRouteTablesRequest.class))).thenReturn(
            DescribeTransitGatewayRouteTablesResponse.builder()
                .transitGatewayRouteTables(TransitGatewayRouteTable.builder().transitGatewayRouteTableId("tgw-rtb-1").build())
                .build());

        assertEquals(ToolResult.success(List.of(Map.of("TransitGatewayRouteTableId", "tgw-rtb-1"))),
            service.listRouteTables(null));

        ArgumentCaptor<DescribeTransitGatewayRouteTablesRequest> captor =
            ArgumentCaptor.forClass(DescribeTransitGatewayRouteTablesRequest.class);
        verify(ec2).describeTransitGatewayRouteTables(captor.capture());
        assertTrue(captor.getValue().filters().isEmpty());
    }

    @Test
    void testCreateRouteTable_TagResourceType() {
        when(ec2.createTransitGatewayRouteTable(any(CreateTransitGatewayRouteTableRequest.class)))
            .thenReturn(CreateTransitGatewayRouteTableResponse.builder().build());

        service.createRouteTable("tgw-1", Map.of("Name", "shared"));

        ArgumentCaptor<CreateTransitGatewayRouteTableRequest> captor =
            ArgumentCaptor.forClass(CreateTransitGatewayRouteTableRequest.class);
        verify(ec2).createTransitGatewayRouteTable(captor.capture());
        assertEquals("transit-gateway-route-table", captor.getValue().tagSpecifications().get(0).resourceTypeAsString());
    }

    @Test
    void testCreateRoute_BlackholeDefault() {
        when(ec2.createTransitGatewayRoute(any(CreateTransitGatewayRouteRequest.class))).thenReturn(
            CreateTransitGatewayRouteResponse.builder()
                .route(TransitGatewayRoute.builder().destinationCidrBlock("10.1.0.0/16").build())
                .build());
        ToolRegistry registry = new ToolRegistry();
        registry.registerAnnotated(service);

        ToolResult result = registry.invoke("create_route", Map.of(
            "transit_gateway_route_table_id", "tgw-rtb-1",
            "destination_cidr_block", "10.1.0.0/16",
            "transit_gateway_attachment_id", "tgw-attach-1"));

        ToolResult.Success success = assertInstanceOf(ToolResult.Success.class, result);
        assertEquals(Map.of("DestinationCidrBlock", "10.1.0.0/16"), success.payload());
        ArgumentCaptor<CreateTransitGatewayRouteRequest> captor = ArgumentCaptor.forClass(CreateTransitGatewayRouteRequest.class);
        verify(ec2).createTransitGatewayRoute(captor.capture());
        assertEquals(Boolean.FALSE, captor.getValue().blackhole());
        assertEquals("tgw-attach-1", captor.getValue().transitGatewayAttachmentId());
    }
}
