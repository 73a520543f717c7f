// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import de.mossgrabers.rppeditor.INotifier;
import de.mossgrabers.rppeditor.core.LexException;
import de.mossgrabers.rppeditor.core.StructureException;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperDocument;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperProject;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;


/**
 * Reads and writes Reaper project files. Project files are always UTF-8 encoded.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperProjectFile
{
    /** The extension of Reaper project files. */
    public static final String EXTENSION = ".rpp";


    /**
     * Constructor.
     */
    private ReaperProjectFile ()
    {
        // Intentionally empty
    }


    /**
     * Read the text of a project file.
     *
     * @param sourceFile The file to read
     * @return The text
     * @throws IOException Could not read the file
     */
    public static String readText (final File sourceFile) throws IOException
    {
        return Files.readString (sourceFile.toPath (), StandardCharsets.UTF_8);
    }


    /**
     * Read and parse a project file.
     *
     * @param sourceFile The file to read
     * @param notifier Where to log to
     * @return The parsed project
     * @throws IOException Could not read the file
     * @throws LexException A line of the file is malformed
     * @throws StructureException The nesting of the chunks is broken
     */
    public static ReaperDocument read (final File sourceFile, final INotifier notifier) throws IOException, LexException, StructureException
    {
        notifier.log ("IDS_NOTIFY_PARSING_FILE", sourceFile.getAbsolutePath ());
        return ReaperProject.parse (readText (sourceFile));
    }


    /**
     * Format a project and write it to a file. An existing file is overwritten.
     *
     * @param document The project to write
     * @param outputFile The file to write to
     * @param notifier Where to log to
     * @return The written text
     * @throws IOException Could not write the file
     */
    public static String write (final ReaperDocument document, final File outputFile, final INotifier notifier) throws IOException
    {
        notifier.log ("IDS_NOTIFY_WRITING_FILE", outputFile.getAbsolutePath ());

        final String formattedProject = ReaperProject.format (document);
        try (final FileWriter writer = new FileWriter (outputFile, StandardCharsets.UTF_8))
        {
            writer.append (formattedProject);
        }
        return formattedProject;
    }
}
