// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import static org.assertj.core.api.Assertions.assertThat;

import de.mossgrabers.rppeditor.core.ReaperProjectException;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperDocument;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperProject;

import org.junit.jupiter.api.Test;


class ProjectSummaryTest
{
    @Test
    void describesTracksAndMidiItems () throws ReaperProjectException
    {
        final ReaperDocument document = ReaperProject.parse (SampleProject.load (SampleProject.SAMPLE));

        assertThat (ProjectSummary.describe (document)).isEqualTo ("Tempo: 85 BPM\n" +
                "Time Signature: 3/4\n" +
                "Tracks: 2\n" +
                "  - Drums\n" +
                "      MIDI: kick.mid at 0s\n" +
                "      MIDI: (embedded) at 8.5s\n" +
                "  - Bass Line");
    }


    @Test
    void describesAnEmptyProject () throws ReaperProjectException
    {
        final ReaperDocument document = ReaperProject.parse ("<REAPER_PROJECT 0.1\n>\n");
        ReaperProjectEditor.setTempo (document, 132.5);

        assertThat (ProjectSummary.describe (document)).isEqualTo ("Tempo: 132.5 BPM\nTime Signature: 4/4\nTracks: 0");
    }
}
