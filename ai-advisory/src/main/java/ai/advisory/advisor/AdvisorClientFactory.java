package ai.advisory.advisor;

@FunctionalInterface
public interface AdvisorClientFactory {
    AdvisorClient create(AdvisorIdentity identity, String apiKey);
}
