package cal.sync.types;

import java.io.IOException;

/**
 * The one-time filesystem migration that runs after the repository is aligned
 * and before the first restore.  It is external to the sync engine; the
 * coordinator only decides when it runs.
 */
@FunctionalInterface
public interface LinkingStep {

  void link() throws IOException;

  LinkingStep NONE = () -> { };

}
