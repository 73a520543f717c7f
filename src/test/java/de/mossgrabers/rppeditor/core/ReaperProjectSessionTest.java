// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.mossgrabers.rppeditor.RecordingNotifier;
import de.mossgrabers.rppeditor.format.reaper.ReaperAccessors;
import de.mossgrabers.rppeditor.format.reaper.ReaperItem;
import de.mossgrabers.rppeditor.format.reaper.ReaperTrack;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperProject;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;


class ReaperProjectSessionTest
{
    @TempDir
    File                      folder;

    private EditorConfig      config;
    private RecordingNotifier notifier;


    @BeforeEach
    void setUp () throws IOException
    {
        this.config = new EditorConfig ();
        this.notifier = new RecordingNotifier ();
    }


    @Test
    void createsAndSavesANewProject () throws IOException, ReaperProjectException
    {
        final File projectFile = new File (this.folder, "Song.rpp");
        final ReaperProjectSession session = ReaperProjectSession.create (projectFile, this.config, this.notifier);

        assertThat (projectFile).exists ();
        assertThat (session.hasUnsavedChanges ()).isFalse ();
        assertThat (ReaperAccessors.getRenderFile (session.getDocument ())).contains ("renders/Song");
        assertThat (this.notifier.getMessages ()).containsExactly ("IDS_NOTIFY_CREATED_PROJECT", "IDS_NOTIFY_WRITING_FILE", "IDS_NOTIFY_SAVED");

        assertThatThrownBy ( () -> ReaperProjectSession.create (projectFile, this.config, this.notifier)).isInstanceOf (FileAlreadyExistsException.class);
        assertThat (this.notifier.getErrors ()).containsExactly ("IDS_NOTIFY_PROJECT_EXISTS");
    }


    @Test
    void missingTemplateIsReported ()
    {
        this.config.setProperty (EditorConfig.PROJECT_TEMPLATE, "does-not-exist");
        final File projectFile = new File (this.folder, "Song.rpp");

        assertThatThrownBy ( () -> ReaperProjectSession.create (projectFile, this.config, this.notifier)).isInstanceOf (FileNotFoundException.class);
        assertThat (this.notifier.getErrors ()).containsExactly ("FileNotFoundException");
        assertThat (projectFile).doesNotExist ();
    }


    @Test
    void editsAreOnlyStoredOnSave () throws IOException, ReaperProjectException
    {
        final File projectFile = new File (this.folder, "Song.rpp");
        ReaperProjectSession.create (projectFile, this.config, this.notifier);
        final String stored = Files.readString (projectFile.toPath (), StandardCharsets.UTF_8);

        final ReaperProjectSession session = ReaperProjectSession.open (projectFile, this.config, this.notifier);
        final ReaperTrack track = session.addTrack ("Drums");
        final ReaperItem item = session.addMidiItem (track, "midi/drums.mid", 0, 4);
        session.setTempo (85);

        assertThat (item.isLoop ()).isTrue ();
        assertThat (session.hasUnsavedChanges ()).isTrue ();
        assertThat (Files.readString (projectFile.toPath (), StandardCharsets.UTF_8)).isEqualTo (stored);

        session.save ();
        assertThat (session.hasUnsavedChanges ()).isFalse ();
        final ReaperProjectSession reopened = ReaperProjectSession.open (projectFile, this.config, this.notifier);
        assertThat (reopened.describe ()).isEqualTo ("Tempo: 85 BPM\nTime Signature: 4/4\nTracks: 1\n  - Drums\n      MIDI: drums.mid at 0s");
    }


    @Test
    void rollbackRestoresTheLastSavedState () throws IOException, ReaperProjectException
    {
        final File projectFile = new File (this.folder, "Song.rpp");
        final ReaperProjectSession session = ReaperProjectSession.create (projectFile, this.config, this.notifier);
        session.addTrack ("Keep");
        session.save ();
        final String saved = ReaperProject.format (session.getDocument ());

        session.addTrack ("Discard");
        session.setTempo (200);
        session.rollback ();

        assertThat (ReaperProject.format (session.getDocument ())).isEqualTo (saved);
        assertThat (ReaperAccessors.getTracks (session.getDocument ())).extracting (ReaperTrack::getName).containsExactly ("Keep");
        assertThat (this.notifier.getMessages ()).endsWith ("IDS_NOTIFY_ROLLBACK");
    }


    @Test
    void loopDefaultComesFromTheConfiguration () throws IOException, ReaperProjectException
    {
        this.config.setProperty (EditorConfig.ITEM_LOOP, "false");
        final ReaperProjectSession session = ReaperProjectSession.create (new File (this.folder, "NoLoop.rpp"), this.config, this.notifier);
        final ReaperTrack track = session.addTrack ("Bass");

        assertThat (session.addMidiItem (track, "midi/bass.mid", 1, 2).isLoop ()).isFalse ();
    }


    @Test
    void failedEditLeavesTheDocumentUnchanged () throws IOException, ReaperProjectException
    {
        final ReaperProjectSession session = ReaperProjectSession.create (new File (this.folder, "Song.rpp"), this.config, this.notifier);

        assertThatThrownBy ( () -> session.setTempo (1000)).isInstanceOf (ValidationException.class);
        assertThat (session.hasUnsavedChanges ()).isFalse ();
    }


    @Test
    void brokenFileIsReported () throws IOException
    {
        final File projectFile = new File (this.folder, "Broken.rpp");
        Files.writeString (projectFile.toPath (), "<REAPER_PROJECT 0.1\n  NAME \"open\n>\n", StandardCharsets.UTF_8);

        assertThatThrownBy ( () -> ReaperProjectSession.open (projectFile, this.config, this.notifier)).isInstanceOf (LexException.class);
        assertThat (this.notifier.getErrors ()).containsExactly ("IDS_NOTIFY_COULD_NOT_READ");
    }


    @Test
    void failedSaveKeepsTheLastSavedState () throws IOException, ReaperProjectException
    {
        final File projectFile = new File (this.folder, "Song.rpp");
        final ReaperProjectSession session = ReaperProjectSession.create (projectFile, this.config, this.notifier);
        session.addTrack ("Drums");

        // Replace the file by a folder to make writing fail
        Files.delete (projectFile.toPath ());
        Files.createDirectory (projectFile.toPath ());

        assertThatThrownBy (session::save).isInstanceOf (IOException.class);
        assertThat (this.notifier.getErrors ()).containsExactly ("IDS_NOTIFY_COULD_NOT_WRITE_FILE");
        session.rollback ();
        assertThat (ReaperAccessors.getTracks (session.getDocument ())).isEmpty ();
    }
}
