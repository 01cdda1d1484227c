package com.elssolution.ammeterlab.archive;

import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.RunStatus;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.ArchiveException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileResultArchiveTest extends ResultArchiveContract {

    @TempDir Path dir;

    private JsonFileResultArchive archive;

    @BeforeEach
    void setUp() {
        archive = new JsonFileResultArchive(dir.toString());
    }

    @Override
    ResultArchive archive() {
        return archive;
    }

    @Test
    void writes_dated_file_and_index() {
        TestRun r = run(DeviceKind.GREENLEE, DAY1, RunStatus.COMPLETED, 2.0);
        archive.store(r);

        assertThat(dir.resolve("20240601_" + r.runId() + ".json")).exists();
        assertThat(dir.resolve(JsonFileResultArchive.INDEX_FILENAME)).exists();
        try (var files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).noneMatch(n -> n.endsWith(".tmp"));
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    @Test
    void reopened_archive_sees_earlier_runs() {
        TestRun r = run(DeviceKind.ENTES, DAY2, RunStatus.COMPLETED, 40.0, 41.0);
        archive.store(r);

        JsonFileResultArchive reopened = new JsonFileResultArchive(dir.toString());
        assertThat(reopened.get(r.runId())).isEqualTo(r);
        assertThat(reopened.summary().totalRuns()).isEqualTo(1);
        assertThatThrownBy(() -> reopened.store(r)).isInstanceOf(ArchiveException.class);
    }

    @Test
    void corrupt_run_file_fails_get_but_is_skipped_by_query() throws IOException {
        TestRun good = run(DeviceKind.CIRCUTOR, DAY1, RunStatus.COMPLETED, 0.02);
        TestRun bad = run(DeviceKind.CIRCUTOR, DAY2, RunStatus.COMPLETED, 0.03);
        archive.store(good);
        archive.store(bad);
        Files.writeString(dir.resolve("20240602_" + bad.runId() + ".json"), "{ not json");

        assertThatThrownBy(() -> archive.get(bad.runId())).isInstanceOf(ArchiveException.class);
        assertThat(archive.query(DeviceKind.CIRCUTOR).map(TestRun::runId)).containsExactly(good.runId());
    }

    @Test
    void corrupt_index_is_reported() throws IOException {
        Files.writeString(dir.resolve(JsonFileResultArchive.INDEX_FILENAME), "[1,2");
        assertThatThrownBy(() -> new JsonFileResultArchive(dir.toString())).isInstanceOf(ArchiveException.class);
    }
}
