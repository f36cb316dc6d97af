package com.awsmcp.mcp.services;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.awsmcp.mcp.api.McpTool;
import com.awsmcp.mcp.api.Param;
import com.awsmcp.mcp.api.RequestParams;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.provider.PageDrain;
import com.awsmcp.mcp.provider.ProviderCall;

import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.CreateImageRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.IamInstanceProfileSpecification;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.RebootInstancesRequest;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.RunInstancesRequest;
import software.amazon.awssdk.services.ec2.model.RunInstancesResponse;
import software.amazon.awssdk.services.ec2.model.StartInstancesRequest;
import software.amazon.awssdk.services.ec2.model.StartInstancesResponse;
import software.amazon.awssdk.services.ec2.model.StopInstancesRequest;
import software.amazon.awssdk.services.ec2.model.StopInstancesResponse;
import software.amazon.awssdk.services.ec2.model.TerminateInstancesRequest;
import software.amazon.awssdk.services.ec2.model.TerminateInstancesResponse;

/**
 * Instance lifecycle tools of the aws-ec2 server
 */
public class Ec2Service {
    private final Ec2Client ec2;

    /**
     * Creates a new Ec2Service
     *
     * @param ec2 shared EC2 client
     */
    public Ec2Service(Ec2Client ec2) {
        this.ec2 = ec2;
    }

    @McpTool(description = "List EC2 instances, optionally filtered by state.")
    public ToolResult listInstances(
            @Param(value = "Instance state to filter on, e.g. running or stopped", defaultValue = "") String state) {
        DescribeInstancesRequest.Builder request = DescribeInstancesRequest.builder();
        RequestParams.ifPresent(state,
            s -> request.filters(Filter.builder().name("instance-state-name").values(s).build()));
        DescribeInstancesRequest firstPage = request.build();

        return ProviderCall.of(() -> PageDrain.drain(
                token -> ec2.describeInstances(firstPage.toBuilder().nextToken(token).build()),
                DescribeInstancesResponse::reservations,
                DescribeInstancesResponse::nextToken))
            .respond(Ec2Service::instancesOf);
    }

    @McpTool(description = "Describe a single EC2 instance.")
    public ToolResult describeInstance(@Param("Instance ID") String instanceId) {
        DescribeInstancesRequest request = DescribeInstancesRequest.builder().instanceIds(instanceId).build();
        return ProviderCall.of(() -> ec2.describeInstances(request))
            .respondFirst(response -> instancesOf(response.reservations()),
                "Instance " + instanceId + " not found");
    }

    @McpTool(description = "Start a stopped EC2 instance.")
    public ToolResult startInstance(@Param("Instance ID") String instanceId) {
        StartInstancesRequest request = StartInstancesRequest.builder().instanceIds(instanceId).build();
        return ProviderCall.of(() -> ec2.startInstances(request))
            .respond(StartInstancesResponse::startingInstances);
    }

    @McpTool(description = "Stop a running EC2 instance.")
    public ToolResult stopInstance(
            @Param("Instance ID") String instanceId,
            @Param(value = "Force the instance to stop without a clean shutdown", defaultValue = "false") boolean force) {
        StopInstancesRequest request = StopInstancesRequest.builder()
            .instanceIds(instanceId)
            .force(force)
            .build();
        return ProviderCall.of(() -> ec2.stopInstances(request))
            .respond(StopInstancesResponse::stoppingInstances);
    }

    @McpTool(description = "Reboot an EC2 instance.")
    public ToolResult rebootInstance(@Param("Instance ID") String instanceId) {
        RebootInstancesRequest request = RebootInstancesRequest.builder().instanceIds(instanceId).build();
        return ProviderCall.of(() -> ec2.rebootInstances(request))
            .respondStatus("Instance " + instanceId + " rebooted");
    }

    @McpTool(description = "Terminate an EC2 instance.")
    public ToolResult terminateInstance(@Param("Instance ID") String instanceId) {
        TerminateInstancesRequest request = TerminateInstancesRequest.builder().instanceIds(instanceId).build();
        return ProviderCall.of(() -> ec2.terminateInstances(request))
            .respond(TerminateInstancesResponse::terminatingInstances);
    }

    @McpTool(description = "Launch new EC2 instances with optional networking and user data.")
    public ToolResult runInstances(
            @Param("AMI ID to launch") String imageId,
            @Param("Instance type, e.g. t3.micro") String instanceType,
            @Param(value = "Key pair name", defaultValue = "") String keyName,
            @Param(value = "Minimum number of instances", defaultValue = "1") int minCount,
            @Param(value = "Maximum number of instances", defaultValue = "1") int maxCount,
            @Param(value = "Subnet to launch into", defaultValue = "") String subnetId,
            @Param(value = "Security group IDs", defaultValue = "") List<String> securityGroupIds,
            @Param(value = "User data script as plain text", defaultValue = "") String userData,
            @Param(value = "IAM instance profile name", defaultValue = "") String iamInstanceProfile) {
        RunInstancesRequest.Builder request = RunInstancesRequest.builder()
            .imageId(imageId)
            .instanceType(instanceType)
            .minCount(minCount)
            .maxCount(maxCount);
        RequestParams.ifPresent(keyName, request::keyName);
        RequestParams.ifPresent(subnetId, request::subnetId);
        RequestParams.ifPresent(securityGroupIds, request::securityGroupIds);
        // the API expects user data base64-encoded
        RequestParams.ifPresent(userData, data -> request.userData(
            Base64.getEncoder().encodeToString(data.getBytes(StandardCharsets.UTF_8))));
        RequestParams.composite(iamInstanceProfile,
            name -> IamInstanceProfileSpecification.builder().name(name).build(),
            request::iamInstanceProfile);

        RunInstancesRequest built = request.build();
        return ProviderCall.of(() -> ec2.runInstances(built))
            .respond(RunInstancesResponse::instances);
    }

    @McpTool(description = "Create an AMI from an instance.")
    public ToolResult createImage(
            @Param("Instance ID to image") String instanceId,
            @Param("Name of the new image") String name,
            @Param(value = "Image description", defaultValue = "") String description,
            @Param(value = "Skip rebooting the instance before imaging", defaultValue = "false") boolean noReboot) {
        CreateImageRequest.Builder request = CreateImageRequest.builder()
            .instanceId(instanceId)
            .name(name)
            .noReboot(noReboot);
        RequestParams.ifPresent(description, request::description);

        CreateImageRequest built = request.build();
        return ProviderCall.of(() -> ec2.createImage(built))
            .respond(response -> Collections.singletonMap("ImageId", response.imageId()));
    }

    @McpTool(description = "Apply tags to EC2 resources.")
    public ToolResult createTags(
            @Param("Resource IDs to tag") List<String> resourceIds,
            @Param("Tags to apply as a key/value mapping") Map<String, String> tags) {
        return Ec2Tags.createTags(ec2, resourceIds, tags);
    }

    private static List<Instance> instancesOf(List<Reservation> reservations) {
        return reservations.stream()
            .flatMap(reservation -> reservation.instances().stream())
            .toList();
    }
}
