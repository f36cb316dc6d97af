package com.awsmcp.mcp.services;

import java.util.List;
import java.util.Map;

import com.awsmcp.mcp.api.McpTool;
import com.awsmcp.mcp.api.Param;
import com.awsmcp.mcp.api.RequestParams;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.provider.PageDrain;
import com.awsmcp.mcp.provider.ProviderCall;
import com.awsmcp.mcp.utils.SdkPojos;

import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.AcceptTransitGatewayVpcAttachmentRequest;
import software.amazon.awssdk.services.ec2.model.AcceptTransitGatewayVpcAttachmentResponse;
import software.amazon.awssdk.services.ec2.model.AssociateTransitGatewayRouteTableRequest;
import software.amazon.awssdk.services.ec2.model.AssociateTransitGatewayRouteTableResponse;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRequest;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayResponse;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRouteRequest;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRouteResponse;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRouteTableRequest;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayRouteTableResponse;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayVpcAttachmentRequest;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayVpcAttachmentRequestOptions;
import software.amazon.awssdk.services.ec2.model.CreateTransitGatewayVpcAttachmentResponse;
import software.amazon.awssdk.services.ec2.model.DeleteTransitGatewayRequest;
import software.amazon.awssdk.services.ec2.model.DeleteTransitGatewayResponse;
import software.amazon.awssdk.services.ec2.model.DeleteTransitGatewayRouteRequest;
import software.amazon.awssdk.services.ec2.model.DeleteTransitGatewayRouteResponse;
import software.amazon.awssdk.services.ec2.model.DeleteTransitGatewayRouteTableRequest;
import software.amazon.awssdk.services.ec2.model.DeleteTransitGatewayRouteTableResponse;
import software.amazon.awssdk.services.ec2.model.DeleteTransitGatewayVpcAttachmentRequest;
import software.amazon.awssdk.services.ec2.model.DeleteTransitGatewayVpcAttachmentResponse;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayAttachmentsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayAttachmentsResponse;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayRouteTablesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayRouteTablesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewaysResponse;
import software.amazon.awssdk.services.ec2.model.DisassociateTransitGatewayRouteTableRequest;
import software.amazon.awssdk.services.ec2.model.DisassociateTransitGatewayRouteTableResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.ModifyTransitGatewayOptions;
import software.amazon.awssdk.services.ec2.model.ModifyTransitGatewayRequest;
import software.amazon.awssdk.services.ec2.model.ModifyTransitGatewayResponse;
import software.amazon.awssdk.services.ec2.model.TransitGatewayRequestOptions;

/**
 * Transit gateway, VPC attachment, route table and route tools of the aws-tgw server.
 * Option switches take the provider's "enable" / "disable" values.
 */
public class TransitGatewayService {
    private static final String TRANSIT_GATEWAY_ID_FILTER = "transit-gateway-id";

    private final Ec2Client ec2;

    public TransitGatewayService(Ec2Client ec2) {
        this.ec2 = ec2;
    }

    @McpTool(description = "List transit gateways.")
    public ToolResult listTransitGateways() {
        return ProviderCall.of(() -> PageDrain.drain(
                token -> ec2.describeTransitGateways(DescribeTransitGatewaysRequest.builder().nextToken(token).build()),
                DescribeTransitGatewaysResponse::transitGateways,
                DescribeTransitGatewaysResponse::nextToken))
            .respond(gateways -> gateways);
    }

    @McpTool(description = "Describe a transit gateway.")
    public ToolResult describeTransitGateway(@Param("Transit gateway ID") String transitGatewayId) {
        DescribeTransitGatewaysRequest request = DescribeTransitGatewaysRequest.builder()
            .transitGatewayIds(transitGatewayId)
            .build();
        return ProviderCall.of(() -> ec2.describeTransitGateways(request))
            .respondFirst(DescribeTransitGatewaysResponse::transitGateways,
                "Transit gateway " + transitGatewayId + " not found");
    }

    @McpTool(description = "Create a transit gateway.")
    public ToolResult createTransitGateway(
            @Param(value = "Description", defaultValue = "") String description,
            @Param(value = "Private ASN for the Amazon side of BGP sessions", defaultValue = "") Long amazonSideAsn,
            @Param(value = "enable or disable", defaultValue = "") String autoAcceptSharedAttachments,
            @Param(value = "enable or disable", defaultValue = "") String defaultRouteTableAssociation,
            @Param(value = "enable or disable", defaultValue = "") String defaultRouteTablePropagation,
            @Param(value = "enable or disable", defaultValue = "") String dnsSupport,
            @Param(value = "enable or disable", defaultValue = "") String vpnEcmpSupport) {
        CreateTransitGatewayRequest.Builder request = CreateTransitGatewayRequest.builder();
        RequestParams.ifPresent(description, request::description);

        if (RequestParams.anyPresent(amazonSideAsn, autoAcceptSharedAttachments, defaultRouteTableAssociation,
                defaultRouteTablePropagation, dnsSupport, vpnEcmpSupport)) {
            TransitGatewayRequestOptions.Builder options = TransitGatewayRequestOptions.builder();
            RequestParams.ifPresent(amazonSideAsn, options::amazonSideAsn);
            RequestParams.ifPresent(autoAcceptSharedAttachments, options::autoAcceptSharedAttachments);
            RequestParams.ifPresent(defaultRouteTableAssociation, options::defaultRouteTableAssociation);
            RequestParams.ifPresent(defaultRouteTablePropagation, options::defaultRouteTablePropagation);
            RequestParams.ifPresent(dnsSupport, options::dnsSupport);
            RequestParams.ifPresent(vpnEcmpSupport, options::vpnEcmpSupport);
            request.options(options.build());
        }

        CreateTransitGatewayRequest built = request.build();
        return ProviderCall.of(() -> ec2.createTransitGateway(built))
            .respond(CreateTransitGatewayResponse::transitGateway);
    }

    @McpTool(description = "Delete a transit gateway.")
    public ToolResult deleteTransitGateway(@Param("Transit gateway ID") String transitGatewayId) {
        DeleteTransitGatewayRequest request = DeleteTransitGatewayRequest.builder()
            .transitGatewayId(transitGatewayId)
            .build();
        return ProviderCall.of(() -> ec2.deleteTransitGateway(request))
            .respond(DeleteTransitGatewayResponse::transitGateway);
    }

    @McpTool(description = "Modify transit gateway options.")
    public ToolResult modifyTransitGateway(
            @Param("Transit gateway ID") String transitGatewayId,
            @Param(value = "Private ASN for the Amazon side of BGP sessions", defaultValue = "") Long amazonSideAsn,
            @Param(value = "enable or disable", defaultValue = "") String autoAcceptSharedAttachments,
            @Param(value = "enable or disable", defaultValue = "") String defaultRouteTableAssociation,
            @Param(value = "enable or disable", defaultValue = "") String defaultRouteTablePropagation,
            @Param(value = "enable or disable", defaultValue = "") String dnsSupport,
            @Param(value = "enable or disable", defaultValue = "") String vpnEcmpSupport,
            @Param(value = "New description", defaultValue = "") String description) {
        ModifyTransitGatewayRequest.Builder request = ModifyTransitGatewayRequest.builder()
            .transitGatewayId(transitGatewayId);
        RequestParams.ifPresent(description, request::description);

        if (RequestParams.anyPresent(amazonSideAsn, autoAcceptSharedAttachments, defaultRouteTableAssociation,
                defaultRouteTablePropagation, dnsSupport, vpnEcmpSupport)) {
            ModifyTransitGatewayOptions.Builder options = ModifyTransitGatewayOptions.builder();
            RequestParams.ifPresent(amazonSideAsn, options::amazonSideAsn);
            RequestParams.ifPresent(autoAcceptSharedAttachments, options::autoAcceptSharedAttachments);
            RequestParams.ifPresent(defaultRouteTableAssociation, options::defaultRouteTableAssociation);
            RequestParams.ifPresent(defaultRouteTablePropagation, options::defaultRouteTablePropagation);
            RequestParams.ifPresent(dnsSupport, options::dnsSupport);
            RequestParams.ifPresent(vpnEcmpSupport, options::vpnEcmpSupport);
            request.options(options.build());
        }

        ModifyTransitGatewayRequest built = request.build();
        return ProviderCall.of(() -> ec2.modifyTransitGateway(built))
            .respond(ModifyTransitGatewayResponse::transitGateway);
    }

    @McpTool(description = "List transit gateway attachments.")
    public ToolResult listTransitGatewayAttachments(
            @Param(value = "Transit gateway ID to filter on", defaultValue = "") String transitGatewayId,
            @Param(value = "Attachment IDs to describe", defaultValue = "") List<String> attachmentIds) {
        DescribeTransitGatewayAttachmentsRequest.Builder request = DescribeTransitGatewayAttachmentsRequest.builder();
        RequestParams.ifPresent(transitGatewayId, id -> request.filters(transitGatewayFilter(id)));
        RequestParams.ifPresent(attachmentIds, request::transitGatewayAttachmentIds);
        DescribeTransitGatewayAttachmentsRequest firstPage = request.build();

        return ProviderCall.of(() -> PageDrain.drain(
                token -> ec2.describeTransitGatewayAttachments(firstPage.toBuilder().nextToken(token).build()),
                DescribeTransitGatewayAttachmentsResponse::transitGatewayAttachments,
                DescribeTransitGatewayAttachmentsResponse::nextToken))
            .respond(attachments -> attachments);
    }

    @McpTool(description = "Attach a VPC to a transit gateway.")
    public ToolResult createVpcAttachment(
            @Param("Transit gateway ID") String transitGatewayId,
            @Param("VPC ID") String vpcId,
            @Param("Subnet IDs, one per availability zone") List<String> subnetIds,
            @Param(value = "Attachment options, e.g. {\"DnsSupport\": \"enable\"}", defaultValue = "") Map<String, Object> options,
            @Param(value = "Tags for the attachment", defaultValue = "") Map<String, String> tags) {
        CreateTransitGatewayVpcAttachmentRequest.Builder request = CreateTransitGatewayVpcAttachmentRequest.builder()
            .transitGatewayId(transitGatewayId)
            .vpcId(vpcId)
            .subnetIds(subnetIds);
        if (RequestParams.hasEntries(options)) {
            request.options(SdkPojos.fromMap("options", options, CreateTransitGatewayVpcAttachmentRequestOptions::builder));
        }
        if (RequestParams.hasEntries(tags)) {
            request.tagSpecifications(Ec2Tags.specification("transit-gateway-attachment", tags));
        }

        CreateTransitGatewayVpcAttachmentRequest built = request.build();
        return ProviderCall.of(() -> ec2.createTransitGatewayVpcAttachment(built))
            .respond(CreateTransitGatewayVpcAttachmentResponse::transitGatewayVpcAttachment);
    }

    @McpTool(description = "Delete a VPC attachment.")
    public ToolResult deleteVpcAttachment(@Param("Transit gateway attachment ID") String transitGatewayAttachmentId) {
        DeleteTransitGatewayVpcAttachmentRequest request = DeleteTransitGatewayVpcAttachmentRequest.builder()
            .transitGatewayAttachmentId(transitGatewayAttachmentId)
            .build();
        return ProviderCall.of(() -> ec2.deleteTransitGatewayVpcAttachment(request))
            .respond(DeleteTransitGatewayVpcAttachmentResponse::transitGatewayVpcAttachment);
    }

    @McpTool(description = "Accept a shared VPC attachment.")
    public ToolResult acceptVpcAttachment(@Param("Transit gateway attachment ID") String transitGatewayAttachmentId) {
        AcceptTransitGatewayVpcAttachmentRequest request = AcceptTransitGatewayVpcAttachmentRequest.builder()
            .transitGatewayAttachmentId(transitGatewayAttachmentId)
            .build();
        return ProviderCall.of(() -> ec2.acceptTransitGatewayVpcAttachment(request))
            .respond(AcceptTransitGatewayVpcAttachmentResponse::transitGatewayVpcAttachment);
    }

    @McpTool(description = "List transit gateway route tables.")
    public ToolResult listRouteTables(
            @Param(value = "Transit gateway ID to filter on", defaultValue = "") String transitGatewayId) {
        DescribeTransitGatewayRouteTablesRequest.Builder request = DescribeTransitGatewayRouteTablesRequest.builder();
        RequestParams.ifPresent(transitGatewayId, id -> request.filters(transitGatewayFilter(id)));
        DescribeTransitGatewayRouteTablesRequest firstPage = request.build();

        return ProviderCall.of(() -> PageDrain.drain(
                token -> ec2.describeTransitGatewayRouteTables(firstPage.toBuilder().nextToken(token).build()),
                DescribeTransitGatewayRouteTablesResponse::transitGatewayRouteTables,
                DescribeTransitGatewayRouteTablesResponse::nextToken))
            .respond(routeTables -> routeTables);
    }

    @McpTool(description = "Create a transit gateway route table.")
    public ToolResult createRouteTable(
            @Param("Transit gateway ID") String transitGatewayId,
            @Param(value = "Tags for the route table", defaultValue = "") Map<String, String> tags) {
        CreateTransitGatewayRouteTableRequest.Builder request = CreateTransitGatewayRouteTableRequest.builder()
            .transitGatewayId(transitGatewayId);
        if (RequestParams.hasEntries(tags)) {
            request.tagSpecifications(Ec2Tags.specification("transit-gateway-route-table", tags));
        }

        CreateTransitGatewayRouteTableRequest built = request.build();
        return ProviderCall.of(() -> ec2.createTransitGatewayRouteTable(built))
            .respond(CreateTransitGatewayRouteTableResponse::transitGatewayRouteTable);
    }

    @McpTool(description = "Delete a transit gateway route table.")
    public ToolResult deleteRouteTable(@Param("Route table ID") String transitGatewayRouteTableId) {
        DeleteTransitGatewayRouteTableRequest request = DeleteTransitGatewayRouteTableRequest.builder()
            .transitGatewayRouteTableId(transitGatewayRouteTableId)
            .build();
        return ProviderCall.of(() -> ec2.deleteTransitGatewayRouteTable(request))
            .respond(DeleteTransitGatewayRouteTableResponse::transitGatewayRouteTable);
    }

    @McpTool(description = "Associate an attachment with a route table.")
    public ToolResult associateRouteTable(
            @Param("Route table ID") String transitGatewayRouteTableId,
            @Param("Transit gateway attachment ID") String transitGatewayAttachmentId) {
        AssociateTransitGatewayRouteTableRequest request = AssociateTransitGatewayRouteTableRequest.builder()
            .transitGatewayRouteTableId(transitGatewayRouteTableId)
            .transitGatewayAttachmentId(transitGatewayAttachmentId)
            .build();
        return ProviderCall.of(() -> ec2.associateTransitGatewayRouteTable(request))
            .respond(AssociateTransitGatewayRouteTableResponse::association);
    }

    @McpTool(description = "Disassociate an attachment from a route table.")
    public ToolResult disassociateRouteTable(
            @Param("Route table ID") String transitGatewayRouteTableId,
            @Param("Transit gateway attachment ID") String transitGatewayAttachmentId) {
        DisassociateTransitGatewayRouteTableRequest request = DisassociateTransitGatewayRouteTableRequest.builder()
            .transitGatewayRouteTableId(transitGatewayRouteTableId)
            .transitGatewayAttachmentId(transitGatewayAttachmentId)
            .build();
        return ProviderCall.of(() -> ec2.disassociateTransitGatewayRouteTable(request))
            .respond(DisassociateTransitGatewayRouteTableResponse::association);
    }

    @McpTool(description = "Create a static route in a transit gateway route table.")
    public ToolResult createRoute(
            @Param("Route table ID") String transitGatewayRouteTableId,
            @Param("Destination CIDR block") String destinationCidrBlock,
            @Param(value = "Attachment to route to", defaultValue = "") String transitGatewayAttachmentId,
            @Param(value = "Drop matching traffic", defaultValue = "false") boolean blackhole) {
        CreateTransitGatewayRouteRequest.Builder request = CreateTransitGatewayRouteRequest.builder()
            .transitGatewayRouteTableId(transitGatewayRouteTableId)
            .destinationCidrBlock(destinationCidrBlock)
            .blackhole(blackhole);
        RequestParams.ifPresent(transitGatewayAttachmentId, request::transitGatewayAttachmentId);

        CreateTransitGatewayRouteRequest built = request.build();
        return ProviderCall.of(() -> ec2.createTransitGatewayRoute(built))
            .respond(CreateTransitGatewayRouteResponse::route);
    }

    @McpTool(description = "Delete a static route from a transit gateway route table.")
    public ToolResult deleteRoute(
            @Param("Route table ID") String transitGatewayRouteTableId,
            @Param("Destination CIDR block") String destinationCidrBlock) {
        DeleteTransitGatewayRouteRequest request = DeleteTransitGatewayRouteRequest.builder()
            .transitGatewayRouteTableId(transitGatewayRouteTableId)
            .destinationCidrBlock(destinationCidrBlock)
            .build();
        return ProviderCall.of(() -> ec2.deleteTransitGatewayRoute(request))
            .respond(DeleteTransitGatewayRouteResponse::route);
    }

    private static Filter transitGatewayFilter(String transitGatewayId) {
        return Filter.builder().name(TRANSIT_GATEWAY_ID_FILTER).values(transitGatewayId).build();
    }
}
