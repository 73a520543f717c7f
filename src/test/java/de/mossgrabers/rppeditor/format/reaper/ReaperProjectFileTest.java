// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.mossgrabers.rppeditor.RecordingNotifier;
import de.mossgrabers.rppeditor.core.ReaperProjectException;
import de.mossgrabers.rppeditor.core.StructureException;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperDocument;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;


class ReaperProjectFileTest
{
    @TempDir
    File folder;


    @Test
    void readsAndWritesUnchanged () throws IOException, ReaperProjectException
    {
        final String text = SampleProject.load (SampleProject.SAMPLE);
        final File source = new File (this.folder, "sample.rpp");
        Files.writeString (source.toPath (), text, StandardCharsets.UTF_8);

        final RecordingNotifier notifier = new RecordingNotifier ();
        final ReaperDocument document = ReaperProjectFile.read (source, notifier);
        final File destination = new File (this.folder, "copy.rpp");
        final String written = ReaperProjectFile.write (document, destination, notifier);

        assertThat (written).isEqualTo (text);
        assertThat (Files.readString (destination.toPath (), StandardCharsets.UTF_8)).isEqualTo (text);
        assertThat (notifier.getMessages ()).containsExactly ("IDS_NOTIFY_PARSING_FILE", "IDS_NOTIFY_WRITING_FILE");
    }


    @Test
    void keepsNonAsciiText () throws IOException, ReaperProjectException
    {
        final String text = "<REAPER_PROJECT 0.1\r\n  <TRACK\r\n    NAME \"Stimme Größe ♪\"\r\n  >\r\n>\r\n";
        final File source = new File (this.folder, "umlaut.rpp");
        Files.writeString (source.toPath (), text, StandardCharsets.UTF_8);

        final ReaperDocument document = ReaperProjectFile.read (source, new RecordingNotifier ());
        assertThat (ReaperAccessors.getTracks (document).get (0).getName ()).isEqualTo ("Stimme Größe ♪");
    }


    @Test
    void missingFileFails ()
    {
        final File missing = new File (this.folder, "missing.rpp");
        assertThatThrownBy ( () -> ReaperProjectFile.read (missing, new RecordingNotifier ())).isInstanceOf (NoSuchFileException.class);
    }


    @Test
    void brokenFileFails () throws IOException
    {
        final File broken = new File (this.folder, "broken.rpp");
        Files.writeString (broken.toPath (), "<REAPER_PROJECT 0.1\n  <TRACK\n>\n", StandardCharsets.UTF_8);
        assertThatThrownBy ( () -> ReaperProjectFile.read (broken, new RecordingNotifier ())).isInstanceOf (StructureException.class);
    }
}
