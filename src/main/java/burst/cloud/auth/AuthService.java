package burst.cloud.auth;

import burst.cloud.config.BurstConfig;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.EnvironmentVariableCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.Ec2ClientBuilder;

import java.time.Duration;

public class AuthService implements AutoCloseable {
    private final Ec2Client ec2;

    public AuthService(BurstConfig config) {
        this(config, EnvironmentVariableCredentialsProvider.create());
    }

    public AuthService(BurstConfig config, AwsCredentialsProvider credentials) {
        this.ec2 = buildClient(config, credentials);
    }

    private static Ec2Client buildClient(BurstConfig config, AwsCredentialsProvider credentials) {
        Ec2ClientBuilder builder = Ec2Client.builder()
                // env vars: AWS_ACCESS_KEY_ID, AWS_SECRET_ACCESS_KEY
                .credentialsProvider(credentials)
                .region(Region.of(config.region()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofMinutes(1))
                        .build());
        if (config.endpointOverride() != null) {
            builder.endpointOverride(config.endpointOverride());
        }
        return builder.build();
    }

    public Ec2Client getEc2() { return ec2; }

    @Override
    public void close() { ec2.close(); }
}
