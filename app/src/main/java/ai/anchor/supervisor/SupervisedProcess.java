package ai.anchor.supervisor;

/**
 * A live process that can be found through the {@link ProcessRegistry}.
 */
public interface SupervisedProcess {
    Role role();

    String sessionId();

    boolean isAlive();
}
