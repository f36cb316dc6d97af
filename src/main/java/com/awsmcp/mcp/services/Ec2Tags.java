package com.awsmcp.mcp.services;

import java.util.List;
import java.util.Map;

import com.awsmcp.mcp.api.RequestParams;
import com.awsmcp.mcp.model.StatusMessage;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.provider.ProviderCall;

import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.CreateTagsRequest;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.TagSpecification;

/**
 * EC2-API tag handling shared by the services that talk to EC2.
 */
final class Ec2Tags {

    private Ec2Tags() {}

    /** Tags in the mapping's insertion order. */
    static List<Tag> toTags(Map<String, String> tags) {
        return RequestParams.keyValuePairs(tags, (key, value) -> Tag.builder().key(key).value(value).build());
    }

    static TagSpecification specification(String resourceType, Map<String, String> tags) {
        return TagSpecification.builder()
            .resourceType(resourceType)
            .tags(toTags(tags))
            .build();
    }

    static ToolResult createTags(Ec2Client ec2, List<String> resourceIds, Map<String, String> tags) {
        CreateTagsRequest request = CreateTagsRequest.builder()
            .resources(resourceIds)
            .tags(toTags(tags))
            .build();
        return ProviderCall.of(() -> ec2.createTags(request))
            .respond(response -> StatusMessage.with("Tags applied", Map.of("resources", resourceIds)));
    }
}
