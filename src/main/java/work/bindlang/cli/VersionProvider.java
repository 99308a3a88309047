package work.bindlang.cli;

import picocli.CommandLine;
import work.bindlang.shared.Version;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        return new String[] { "bind-run (java) " + Version.current() };
    }
}
