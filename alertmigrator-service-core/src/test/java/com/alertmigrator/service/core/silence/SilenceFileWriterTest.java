package com.alertmigrator.service.core.silence;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertmigrator.unified.model.MatchType;
import com.alertmigrator.unified.model.Silence;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SilenceFileWriterTest {

    @TempDir
    Path dataDir;

    private final SilenceFactory factory =
            new SilenceFactory(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    void writesReadsAndDeletesOrgFile() throws Exception {
        SilenceFileWriter writer = new SilenceFileWriter(dataDir);
        List<Silence> silences = List.of(factory.noData("r1"), factory.error("r2"));

        writer.write(7, silences);

        Path file = dataDir.resolve("alerting").resolve("7").resolve("silences");
        assertThat(writer.fileFor(7)).isEqualTo(file);
        assertThat(Files.readString(file)).contains("\"DatasourceNoData\"").contains("\"=\"");
        List<Silence> read = writer.read(7);
        assertThat(read).isEqualTo(silences);
        assertThat(read.get(0).matchers().get(0).type()).isEqualTo(MatchType.EQUAL);

        assertThat(writer.delete(7)).isTrue();
        assertThat(writer.delete(7)).isFalse();
        assertThat(writer.read(7)).isEmpty();
    }

    @Test
    void emptyListWritesNothing() {
        SilenceFileWriter writer = new SilenceFileWriter(dataDir);

        writer.write(7, List.of());

        assertThat(writer.fileFor(7)).doesNotExist();
    }
}
