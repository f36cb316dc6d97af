package com.awsmcp.mcp.services;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awsmcp.mcp.api.McpTool;
import com.awsmcp.mcp.api.Param;
import com.awsmcp.mcp.model.StatusMessage;
import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.provider.PageDrain;
import com.awsmcp.mcp.provider.ProviderCall;
import com.awsmcp.mcp.utils.Json;

import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Bucket, object and bucket policy tools of the aws-s3 server
 */
public class S3Service {
    private static final Logger LOG = LoggerFactory.getLogger(S3Service.class);

    /** Region whose buckets take no location constraint. */
    static final String DEFAULT_BUCKET_REGION = "us-east-1";

    private final S3Client s3;
    private final String region;

    /**
     * Creates a new S3Service
     *
     * @param s3 shared S3 client
     * @param region configured provider region, used when create_bucket gets none
     */
    public S3Service(S3Client s3, String region) {
        this.s3 = s3;
        this.region = region;
    }

    @McpTool(description = "List all S3 buckets.")
    public ToolResult listBuckets() {
        return ProviderCall.of(() -> s3.listBuckets(ListBucketsRequest.builder().build()))
            .respond(ListBucketsResponse::buckets);
    }

    @McpTool(description = "Create a new S3 bucket.")
    public ToolResult createBucket(
            @Param("Bucket name") String bucketName,
            @Param(value = "Region to create the bucket in; defaults to the configured region", defaultValue = "") String region) {
        String targetRegion = region != null ? region : this.region;
        CreateBucketRequest.Builder request = CreateBucketRequest.builder().bucket(bucketName);
        if (!DEFAULT_BUCKET_REGION.equals(targetRegion)) {
            request.createBucketConfiguration(CreateBucketConfiguration.builder()
                .locationConstraint(targetRegion)
                .build());
        }

        CreateBucketRequest built = request.build();
        return ProviderCall.of(() -> s3.createBucket(built))
            .respond(response -> response);
    }

    @McpTool(description = "Delete an S3 bucket.")
    public ToolResult deleteBucket(@Param("Bucket name") String bucketName) {
        DeleteBucketRequest request = DeleteBucketRequest.builder().bucket(bucketName).build();
        return ProviderCall.of(() -> s3.deleteBucket(request))
            .respondStatus("Bucket deletion initiated.");
    }

    @McpTool(description = "List objects within an S3 bucket.")
    public ToolResult listObjects(
            @Param("Bucket name") String bucketName,
            @Param(value = "Key prefix to filter on", defaultValue = "") String prefix) {
        ListObjectsV2Request.Builder request = ListObjectsV2Request.builder().bucket(bucketName);
        if (prefix != null) {
            request.prefix(prefix);
        }
        ListObjectsV2Request firstPage = request.build();

        return ProviderCall.of(() -> PageDrain.drain(
                token -> s3.listObjectsV2(firstPage.toBuilder().continuationToken(token).build()),
                ListObjectsV2Response::contents,
                ListObjectsV2Response::nextContinuationToken))
            .respond(objects -> objects);
    }

    @McpTool(description = "Upload an object to S3 from a local file or inline content.")
    public ToolResult uploadObject(
            @Param("Bucket name") String bucketName,
            @Param("Object key") String objectKey,
            @Param(value = "Local file to upload; ~ expands to the home directory", defaultValue = "") String filePath,
            @Param(value = "Inline content to upload when no file is given", defaultValue = "") String content,
            @Param(value = "Whether content is base64-encoded binary", defaultValue = "false") boolean isBase64) {
        if ((filePath == null || filePath.isEmpty()) && content == null) {
            return ToolResult.validationError("Either file_path or content must be provided.");
        }

        PutObjectRequest request = PutObjectRequest.builder().bucket(bucketName).key(objectKey).build();
        Map<String, Object> uploaded = new LinkedHashMap<>();
        uploaded.put("bucket", bucketName);
        uploaded.put("key", objectKey);

        if (filePath != null && !filePath.isEmpty()) {
            Path source = expandHome(filePath);
            return ProviderCall.of(() -> {
                try (InputStream in = Files.newInputStream(source)) {
                    return s3.putObject(request, RequestBody.fromInputStream(in, Files.size(source)));
                }
            }).respond(response -> uploaded);
        }

        byte[] data;
        if (isBase64) {
            try {
                data = Base64.getDecoder().decode(content);
            } catch (IllegalArgumentException e) {
                return ToolResult.validationError("content is not valid base64: " + e.getMessage());
            }
        } else {
            data = content.getBytes(StandardCharsets.UTF_8);
        }
        return ProviderCall.of(() -> s3.putObject(request, RequestBody.fromBytes(data)))
            .respond(response -> uploaded);
    }

    @McpTool(description = "Download an object from S3 to the local filesystem.")
    public ToolResult downloadObject(
            @Param("Bucket name") String bucketName,
            @Param("Object key") String objectKey,
            @Param("Destination file; ~ expands to the home directory, parent directories are created") String destinationPath) {
        Path destination = expandHome(destinationPath);
        GetObjectRequest request = GetObjectRequest.builder().bucket(bucketName).key(objectKey).build();

        return ProviderCall.of(() -> {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (ResponseInputStream<GetObjectResponse> in = s3.getObject(request);
                 OutputStream out = Files.newOutputStream(destination)) {
                long bytes = in.transferTo(out);
                LOG.debug("Wrote {} bytes of s3://{}/{} to {}", bytes, bucketName, objectKey, destination);
                return bytes;
            }
        }).respondStatus("Object saved to " + destination);
    }

    @McpTool(description = "Delete an object from S3.")
    public ToolResult deleteObject(
            @Param("Bucket name") String bucketName,
            @Param("Object key") String objectKey) {
        DeleteObjectRequest request = DeleteObjectRequest.builder().bucket(bucketName).key(objectKey).build();
        return ProviderCall.of(() -> s3.deleteObject(request))
            .respondOrStatus(response -> response, "Object deletion initiated");
    }

    @McpTool(description = "Retrieve the policy of an S3 bucket.")
    public ToolResult getBucketPolicy(@Param("Bucket name") String bucketName) {
        GetBucketPolicyRequest request = GetBucketPolicyRequest.builder().bucket(bucketName).build();
        ToolResult result = ProviderCall.of(() -> s3.getBucketPolicy(request))
            .respond(response -> Json.readObject(response.policy()));

        if (result instanceof ToolResult.ProviderError error && "NoSuchBucketPolicy".equals(error.code())) {
            return ToolResult.success(StatusMessage.of("Bucket policy not found"));
        }
        return result;
    }

    @McpTool(description = "Set the policy of an S3 bucket.")
    public ToolResult setBucketPolicy(
            @Param("Bucket name") String bucketName,
            @Param("Bucket policy document as a JSON string") String policyJson) {
        PutBucketPolicyRequest request = PutBucketPolicyRequest.builder()
            .bucket(bucketName)
            .policy(policyJson)
            .build();
        return ProviderCall.of(() -> s3.putBucketPolicy(request))
            .respondStatus("Bucket policy updated");
    }

    static Path expandHome(String path) {
        if (path.equals("~")) {
            return Paths.get(System.getProperty("user.home"));
        }
        if (path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), path.substring(2));
        }
        return Paths.get(path);
    }
}
