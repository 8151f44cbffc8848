package burst.cloud.model;

public record KeyMaterial(String keyName, String fingerprint, String privateKey) {

    @Override
    public String toString() {
        // never log the private half
        return "KeyMaterial{keyName='" + keyName + "', fingerprint='" + fingerprint + "'}";
    }
}
