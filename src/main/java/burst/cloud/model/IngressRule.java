package burst.cloud.model;

/**
 * Inbound TCP rule on a security group.
 */
public record IngressRule(String protocol, int fromPort, int toPort, String cidr) {

    public static IngressRule tcp(int fromPort, int toPort, String cidr) {
        return new IngressRule("tcp", fromPort, toPort, cidr);
    }
}
