package cal.sync.impls;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class GitInfoExcludeTests {

  @Test
  public void testRegisterIsIdempotent() throws IOException {
    Path repo = Files.createTempDirectory("exclude");
    Path file = repo.resolve(".git/info/exclude");
    Files.createDirectories(file.getParent());
    Files.writeString(file, "# git ls-files --others --exclude-from=.git/info/exclude\n", StandardCharsets.UTF_8);

    GitInfoExclude exclude = new GitInfoExclude(repo);
    exclude.register(List.of("a.bin", "dir/b.bin", " "));
    exclude.register(List.of("a.bin", "c.bin"));

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    Assert.assertEquals(lines, List.of(
            "# git ls-files --others --exclude-from=.git/info/exclude",
            "a.bin",
            "dir/b.bin",
            "c.bin"));
  }

  @Test
  public void testCreatesMissingFile() throws IOException {
    Path repo = Files.createTempDirectory("exclude");
    new GitInfoExclude(repo).register(List.of(".sync-complete"));
    Assert.assertEquals(Files.readAllLines(repo.resolve(".git/info/exclude")), List.of(".sync-complete"));
  }

}
