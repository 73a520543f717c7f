// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;


class EditorConfigTest
{
    @TempDir
    File folder;


    @Test
    void readsDefaults () throws IOException
    {
        final EditorConfig config = new EditorConfig ();
        assertThat (config.getTemplateName ()).isEqualTo ("minimal");
        assertThat (config.getSampleRate ()).isEqualTo (44100);
        assertThat (config.getTempo ()).isEqualTo (120.0);
        assertThat (config.getLineSeparator ()).isEqualTo ("\r\n");
        assertThat (config.isItemLoop ()).isTrue ();
    }


    @Test
    void userSettingsOverwriteDefaults () throws IOException
    {
        final File userSettings = new File (this.folder, "editor.properties");
        Files.writeString (userSettings.toPath (), "project.tempo = 90\nproject.lineending=lf\nitem.loop=false\n", StandardCharsets.UTF_8);

        final EditorConfig config = EditorConfig.load (userSettings);
        assertThat (config.getTempo ()).isEqualTo (90.0);
        assertThat (config.getLineSeparator ()).isEqualTo ("\n");
        assertThat (config.isItemLoop ()).isFalse ();
        assertThat (config.getSampleRate ()).isEqualTo (44100);
    }


    @Test
    void missingUserSettingsAreIgnored () throws IOException
    {
        final EditorConfig config = EditorConfig.load (new File (this.folder, "none.properties"));
        assertThat (config.getTemplateName ()).isEqualTo ("minimal");
    }


    @Test
    void malformedNumbersFail () throws IOException
    {
        final EditorConfig config = new EditorConfig ();
        config.setProperty (EditorConfig.PROJECT_SAMPLE_RATE, "fast");
        config.setProperty (EditorConfig.PROJECT_TEMPO, "slow");

        assertThatThrownBy (config::getSampleRate).isInstanceOf (IllegalStateException.class).hasMessageContaining (EditorConfig.PROJECT_SAMPLE_RATE);
        assertThatThrownBy (config::getTempo).isInstanceOf (IllegalStateException.class).hasMessageContaining (EditorConfig.PROJECT_TEMPO);
    }
}
