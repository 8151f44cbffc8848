package burst.cloud.api;

import burst.cloud.auth.AuthService;
import burst.cloud.model.IngressRule;
import burst.cloud.model.InstanceDescription;
import burst.cloud.model.KeyMaterial;
import burst.cloud.model.LaunchSpec;
import burst.cloud.model.SpotRequestStatus;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.AuthorizeSecurityGroupIngressRequest;
import software.amazon.awssdk.services.ec2.model.CancelSpotInstanceRequestsRequest;
import software.amazon.awssdk.services.ec2.model.CreateKeyPairRequest;
import software.amazon.awssdk.services.ec2.model.CreateKeyPairResponse;
import software.amazon.awssdk.services.ec2.model.CreateSecurityGroupRequest;
import software.amazon.awssdk.services.ec2.model.DeleteKeyPairRequest;
import software.amazon.awssdk.services.ec2.model.DeleteSecurityGroupRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSpotInstanceRequestsRequest;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.RequestSpotInstancesRequest;
import software.amazon.awssdk.services.ec2.model.RequestSpotInstancesResponse;
import software.amazon.awssdk.services.ec2.model.RequestSpotLaunchSpecification;
import software.amazon.awssdk.services.ec2.model.SpotInstanceRequest;
import software.amazon.awssdk.services.ec2.model.TerminateInstancesRequest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * {@link ControlPlane} backed by the EC2 API (AWS SDK v2, synchronous client).
 */
public class Ec2ControlPlane implements ControlPlane {

    private final Ec2Client ec2;

    public Ec2ControlPlane(AuthService auth) {
        this(auth.getEc2());
    }

    public Ec2ControlPlane(Ec2Client ec2) {
        this.ec2 = ec2;
    }

    @Override
    public String createSecurityGroup(String name, String description) {
        return call("create security group " + name, () -> ec2.createSecurityGroup(
                CreateSecurityGroupRequest.builder()
                        .groupName(name)
                        .description(description)
                        .build()).groupId());
    }

    @Override
    public void authorizeIngress(String securityGroupId, IngressRule rule) {
        call("authorize ingress on " + securityGroupId, () -> ec2.authorizeSecurityGroupIngress(
                AuthorizeSecurityGroupIngressRequest.builder()
                        .groupId(securityGroupId)
                        .ipProtocol(rule.protocol())
                        .fromPort(rule.fromPort())
                        .toPort(rule.toPort())
                        .cidrIp(rule.cidr())
                        .build()));
    }

    @Override
    public KeyMaterial createKeyPair(String keyName) {
        CreateKeyPairResponse res = call("create key pair " + keyName, () -> ec2.createKeyPair(
                CreateKeyPairRequest.builder().keyName(keyName).build()));
        return new KeyMaterial(res.keyName(), res.keyFingerprint(), res.keyMaterial());
    }

    @Override
    public List<String> requestSpotInstances(LaunchSpec spec, int count) {
        RequestSpotLaunchSpecification launch = RequestSpotLaunchSpecification.builder()
                .imageId(spec.imageId())
                .instanceType(spec.instanceType())
                .securityGroupIds(spec.securityGroupId())
                .keyName(spec.keyName())
                .build();

        RequestSpotInstancesResponse res = call("request spot instances", () -> ec2.requestSpotInstances(
                RequestSpotInstancesRequest.builder()
                        .instanceCount(count)
                        .launchSpecification(launch)
                        .build()));

        List<String> ids = new ArrayList<>();
        for (SpotInstanceRequest sir : res.spotInstanceRequests()) {
            if (sir.spotInstanceRequestId() != null) {
                ids.add(sir.spotInstanceRequestId());
            }
        }
        return ids;
    }

    @Override
    public List<SpotRequestStatus> describeSpotRequests(Collection<String> requestIds) {
        List<SpotInstanceRequest> requests = call("describe spot instance requests",
                () -> ec2.describeSpotInstanceRequests(DescribeSpotInstanceRequestsRequest.builder()
                        .spotInstanceRequestIds(requestIds)
                        .build()).spotInstanceRequests());

        List<SpotRequestStatus> out = new ArrayList<>(requests.size());
        for (SpotInstanceRequest sir : requests) {
            out.add(new SpotRequestStatus(sir.spotInstanceRequestId(), sir.stateAsString(), sir.instanceId()));
        }
        return out;
    }

    @Override
    public void cancelSpotRequests(Collection<String> requestIds) {
        call("cancel spot instance requests", () -> ec2.cancelSpotInstanceRequests(
                CancelSpotInstanceRequestsRequest.builder()
                        .spotInstanceRequestIds(requestIds)
                        .build()));
    }

    @Override
    public List<InstanceDescription> describeInstances(Collection<String> instanceIds) {
        List<Reservation> reservations = call("describe instances", () -> ec2.describeInstances(
                DescribeInstancesRequest.builder().instanceIds(instanceIds).build()).reservations());

        List<InstanceDescription> out = new ArrayList<>();
        for (Reservation reservation : reservations) {
            for (Instance instance : reservation.instances()) {
                out.add(new InstanceDescription(
                        instance.instanceId(),
                        instance.instanceTypeAsString(),
                        instance.privateIpAddress(),
                        instance.publicDnsName(),
                        instance.publicIpAddress()));
            }
        }
        return out;
    }

    @Override
    public void terminateInstances(Collection<String> instanceIds) {
        call("terminate instances", () -> ec2.terminateInstances(
                TerminateInstancesRequest.builder().instanceIds(instanceIds).build()));
    }

    @Override
    public void deleteSecurityGroup(String securityGroupId) {
        call("delete security group " + securityGroupId, () -> ec2.deleteSecurityGroup(
                DeleteSecurityGroupRequest.builder().groupId(securityGroupId).build()));
    }

    @Override
    public void deleteKeyPair(String keyName) {
        call("delete key pair " + keyName, () -> ec2.deleteKeyPair(
                DeleteKeyPairRequest.builder().keyName(keyName).build()));
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (SdkException e) {
            throw translate(operation, e);
        } catch (ControlPlaneException e) {
            throw e;
        } catch (RuntimeException e) {
            // a closed client fails with IllegalStateException rather than an SdkException
            throw new ControlPlaneException("failed to " + operation + ": " + e, null, false, e);
        }
    }

    static ControlPlaneException translate(String operation, SdkException e) {
        if (e instanceof AwsServiceException service) {
            String code = service.awsErrorDetails() != null ? service.awsErrorDetails().errorCode() : null;
            return new ControlPlaneException(
                    "failed to " + operation + ": " + e.getMessage(), code, false, e);
        }
        boolean transientDrop = e instanceof SdkClientException && isConnectionDrop(e);
        return new ControlPlaneException("failed to " + operation + ": " + e.getMessage(), null, transientDrop, e);
    }

    private static boolean isConnectionDrop(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IOException) {
                return true;
            }
            String msg = t.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("connection reset")
                        || lower.contains("broken pipe")
                        || lower.contains("pooled stream disconnected")) {
                    return true;
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
