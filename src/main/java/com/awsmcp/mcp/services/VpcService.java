package com.awsmcp.mcp.services;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awsmcp.mcp.api.McpTool;
import com.awsmcp.mcp.api.Param;
import com.awsmcp.mcp.api.RequestParams;
import com.awsmcp.mcp.model.StatusMessage;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.provider.PageDrain;
import com.awsmcp.mcp.provider.ProviderCall;
import com.awsmcp.mcp.utils.SdkPojos;

import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.AssociateVpcCidrBlockRequest;
import software.amazon.awssdk.services.ec2.model.AttributeBooleanValue;
import software.amazon.awssdk.services.ec2.model.CreateSubnetRequest;
import software.amazon.awssdk.services.ec2.model.CreateSubnetResponse;
import software.amazon.awssdk.services.ec2.model.CreateVpcRequest;
import software.amazon.awssdk.services.ec2.model.DeleteSubnetRequest;
import software.amazon.awssdk.services.ec2.model.DeleteVpcRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsResponse;
import software.amazon.awssdk.services.ec2.model.DescribeVpcsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVpcsResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.ModifyVpcAttributeRequest;
import software.amazon.awssdk.services.ec2.model.Vpc;

/**
 * VPC and subnet tools of the aws-vpc server
 */
public class VpcService {
    private static final Logger LOG = LoggerFactory.getLogger(VpcService.class);

    private final Ec2Client ec2;

    public VpcService(Ec2Client ec2) {
        this.ec2 = ec2;
    }

    @McpTool(description = "List VPCs.")
    public ToolResult listVpcs() {
        return ProviderCall.of(() -> PageDrain.drain(
                token -> ec2.describeVpcs(DescribeVpcsRequest.builder().nextToken(token).build()),
                DescribeVpcsResponse::vpcs,
                DescribeVpcsResponse::nextToken))
            .respond(vpcs -> vpcs);
    }

    @McpTool(description = "Describe a VPC.")
    public ToolResult describeVpc(@Param("VPC ID") String vpcId) {
        DescribeVpcsRequest request = DescribeVpcsRequest.builder().vpcIds(vpcId).build();
        return ProviderCall.of(() -> ec2.describeVpcs(request))
            .respondFirst(DescribeVpcsResponse::vpcs, "VPC " + vpcId + " not found");
    }

    /**
     * Create a VPC and, when requested, associate an Amazon-provided IPv6 block with it.
     * The two calls are not atomic: if the association fails the VPC stays, and the reported
     * error names its VpcId so the caller can clean up.
     */
    @McpTool(description = "Create a VPC, optionally with an Amazon-provided IPv6 CIDR block.")
    public ToolResult createVpc(
            @Param("IPv4 CIDR block, e.g. 10.0.0.0/16") String cidrBlock,
            @Param(value = "Associate an Amazon-provided IPv6 CIDR block", defaultValue = "false") boolean ipv6Support,
            @Param(value = "default or dedicated", defaultValue = "default") String instanceTenancy) {
        CreateVpcRequest request = CreateVpcRequest.builder()
            .cidrBlock(cidrBlock)
            .instanceTenancy(instanceTenancy)
            .build();

        return ProviderCall.of(() -> ec2.createVpc(request)).then(created -> {
            Vpc vpc = created.vpc();
            if (!ipv6Support || vpc == null) {
                return ToolResult.success(SdkPojos.toPlain(vpc));
            }
            return associateIpv6(vpc);
        });
    }

    private ToolResult associateIpv6(Vpc vpc) {
        AssociateVpcCidrBlockRequest request = AssociateVpcCidrBlockRequest.builder()
            .vpcId(vpc.vpcId())
            .amazonProvidedIpv6CidrBlock(true)
            .build();
        ToolResult result = ProviderCall.of(() -> ec2.associateVpcCidrBlock(request))
            .respond(associated -> vpc);
        if (result.isSuccess()) {
            return result;
        }

        LOG.warn("VPC {} was created but IPv6 association failed; it is left in place", vpc.vpcId());
        if (result instanceof ToolResult.ProviderError providerError) {
            return providerError.withContext("VpcId", vpc.vpcId());
        }
        if (result instanceof ToolResult.TransportError transportError) {
            return transportError.withNote("VPC " + vpc.vpcId() + " was created");
        }
        return result;
    }

    @McpTool(description = "Delete a VPC.")
    public ToolResult deleteVpc(@Param("VPC ID") String vpcId) {
        DeleteVpcRequest request = DeleteVpcRequest.builder().vpcId(vpcId).build();
        return ProviderCall.of(() -> ec2.deleteVpc(request))
            .respondStatus("VPC " + vpcId + " deletion initiated");
    }

    /**
     * The provider accepts one attribute per call, so each present attribute is sent separately.
     */
    @McpTool(description = "Modify VPC DNS attributes.")
    public ToolResult modifyVpcAttribute(
            @Param("VPC ID") String vpcId,
            @Param(value = "Enable DNS resolution", defaultValue = "") Boolean enableDnsSupport,
            @Param(value = "Enable DNS hostnames", defaultValue = "") Boolean enableDnsHostnames) {
        return ProviderCall.of(() -> {
            if (enableDnsSupport != null) {
                ec2.modifyVpcAttribute(ModifyVpcAttributeRequest.builder()
                    .vpcId(vpcId)
                    .enableDnsSupport(AttributeBooleanValue.builder().value(enableDnsSupport).build())
                    .build());
            }
            if (enableDnsHostnames != null) {
                ec2.modifyVpcAttribute(ModifyVpcAttributeRequest.builder()
                    .vpcId(vpcId)
                    .enableDnsHostnames(AttributeBooleanValue.builder().value(enableDnsHostnames).build())
                    .build());
            }
            return vpcId;
        }).respond(id -> StatusMessage.with("VPC attributes updated", Map.of("vpc_id", id)));
    }

    @McpTool(description = "List subnets, optionally filtered by VPC.")
    public ToolResult listSubnets(@Param(value = "VPC ID to filter on", defaultValue = "") String vpcId) {
        DescribeSubnetsRequest.Builder request = DescribeSubnetsRequest.builder();
        RequestParams.ifPresent(vpcId, id -> request.filters(Filter.builder().name("vpc-id").values(id).build()));
        DescribeSubnetsRequest firstPage = request.build();

        return ProviderCall.of(() -> PageDrain.drain(
                token -> ec2.describeSubnets(firstPage.toBuilder().nextToken(token).build()),
                DescribeSubnetsResponse::subnets,
                DescribeSubnetsResponse::nextToken))
            .respond(subnets -> subnets);
    }

    @McpTool(description = "Create a subnet in a VPC.")
    public ToolResult createSubnet(
            @Param("VPC ID") String vpcId,
            @Param("IPv4 CIDR block") String cidrBlock,
            @Param(value = "Availability zone", defaultValue = "") String availabilityZone) {
        CreateSubnetRequest.Builder request = CreateSubnetRequest.builder()
            .vpcId(vpcId)
            .cidrBlock(cidrBlock);
        RequestParams.ifPresent(availabilityZone, request::availabilityZone);

        CreateSubnetRequest built = request.build();
        return ProviderCall.of(() -> ec2.createSubnet(built))
            .respond(CreateSubnetResponse::subnet);
    }

    @McpTool(description = "Delete a subnet.")
    public ToolResult deleteSubnet(@Param("Subnet ID") String subnetId) {
        DeleteSubnetRequest request = DeleteSubnetRequest.builder().subnetId(subnetId).build();
        return ProviderCall.of(() -> ec2.deleteSubnet(request))
            .respondStatus("Subnet " + subnetId + " deletion initiated");
    }

    @McpTool(description = "Apply tags to VPC resources.")
    public ToolResult createTags(
            @Param("Resource IDs to tag") List<String> resourceIds,
            @Param("Tags to apply as a key/value mapping") Map<String, String> tags) {
        return Ec2Tags.createTags(ec2, resourceIds, tags);
    }
}
