// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.core;

import de.mossgrabers.rppeditor.INotifier;
import de.mossgrabers.rppeditor.format.reaper.ProjectSummary;
import de.mossgrabers.rppeditor.format.reaper.ReaperItem;
import de.mossgrabers.rppeditor.format.reaper.ReaperProjectEditor;
import de.mossgrabers.rppeditor.format.reaper.ReaperProjectFile;
import de.mossgrabers.rppeditor.format.reaper.ReaperTrack;
import de.mossgrabers.rppeditor.format.reaper.model.Parameter;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperDocument;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperProject;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.util.Locale;


/**
 * Edits one project file. Changes are applied to the document in memory and only written with
 * {@link #save()}. The text of the last successful read or save is kept so that all changes
 * since then can be discarded with {@link #rollback()}.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperProjectSession
{
    private static final String RENDER_FOLDER = "renders/";

    private final File          projectFile;
    private final EditorConfig  config;
    private final INotifier     notifier;
    private ReaperDocument      document;
    private String              lastKnownGood;


    /**
     * Constructor.
     *
     * @param projectFile The project file
     * @param config The configuration
     * @param notifier Where to log to
     * @param document The project
     * @param lastKnownGood The text which is currently stored in the file
     */
    private ReaperProjectSession (final File projectFile, final EditorConfig config, final INotifier notifier, final ReaperDocument document, final String lastKnownGood)
    {
        this.projectFile = projectFile;
        this.config = config;
        this.notifier = notifier;
        this.document = document;
        this.lastKnownGood = lastKnownGood;
    }


    /**
     * Open an existing project file.
     *
     * @param projectFile The project file
     * @param config The configuration
     * @param notifier Where to log to
     * @return The session
     * @throws IOException Could not read the file
     * @throws ReaperProjectException The file is not a valid project
     */
    public static ReaperProjectSession open (final File projectFile, final EditorConfig config, final INotifier notifier) throws IOException, ReaperProjectException
    {
        notifier.log ("IDS_NOTIFY_PARSING_FILE", projectFile.getAbsolutePath ());

        try
        {
            final String text = ReaperProjectFile.readText (projectFile);
            return new ReaperProjectSession (projectFile, config, notifier, ReaperProject.parse (text), text);
        }
        catch (final IOException | ReaperProjectException ex)
        {
            notifier.logError ("IDS_NOTIFY_COULD_NOT_READ", ex);
            throw ex;
        }
    }


    /**
     * Create a new project from the configured template and write it to the given file. The
     * render file of the project is set to the name of the project file in the renders folder.
     *
     * @param projectFile The project file, must not exist
     * @param config The configuration
     * @param notifier Where to log to
     * @return The session
     * @throws IOException The file already exists, the template could not be read or the file
     *             could not be written
     * @throws ReaperProjectException The template is not a valid project
     */
    public static ReaperProjectSession create (final File projectFile, final EditorConfig config, final INotifier notifier) throws IOException, ReaperProjectException
    {
        if (projectFile.exists ())
        {
            notifier.logError ("IDS_NOTIFY_PROJECT_EXISTS", projectFile.getAbsolutePath ());
            throw new FileAlreadyExistsException (projectFile.getAbsolutePath ());
        }

        final ReaperDocument document;
        try
        {
            document = ReaperProjectEditor.createProject (config);
        }
        catch (final IOException | ReaperProjectException ex)
        {
            notifier.logError (ex);
            throw ex;
        }
        String projectName = projectFile.getName ();
        if (projectName.toLowerCase (Locale.US).endsWith (ReaperProjectFile.EXTENSION))
            projectName = projectName.substring (0, projectName.length () - ReaperProjectFile.EXTENSION.length ());
        ReaperProjectEditor.setRenderFile (document, RENDER_FOLDER + projectName);
        notifier.log ("IDS_NOTIFY_CREATED_PROJECT", config.getTemplateName ());

        final ReaperProjectSession session = new ReaperProjectSession (projectFile, config, notifier, document, null);
        session.save ();
        return session;
    }


    /**
     * Get the project file.
     *
     * @return The file
     */
    public File getProjectFile ()
    {
        return this.projectFile;
    }


    /**
     * Get the project in its' current, possibly unsaved state.
     *
     * @return The project
     */
    public ReaperDocument getDocument ()
    {
        return this.document;
    }


    /**
     * Add a new track to the end of the project.
     *
     * @param name The name of the track
     * @return The new track
     * @throws ValidationException The name cannot be written to a project file
     */
    public ReaperTrack addTrack (final String name) throws ValidationException
    {
        final ReaperTrack track = ReaperProjectEditor.addTrack (this.document, name);
        this.notifier.log ("IDS_NOTIFY_ADDED_TRACK", name);
        return track;
    }


    /**
     * Add a MIDI item to a track. Looping is taken from the configuration.
     *
     * @param track The track
     * @param filePath The path of the MIDI file relative to the project folder
     * @param startTime The start of the item in seconds
     * @param length The length of the item in seconds
     * @return The new item
     * @throws ReaperProjectException The values are out of range or the track is not part of the
     *             project
     */
    public ReaperItem addMidiItem (final ReaperTrack track, final String filePath, final double startTime, final double length) throws ReaperProjectException
    {
        final ReaperItem item = ReaperProjectEditor.addMidiItem (this.document, track, filePath, startTime, length, this.config.isItemLoop ());
        this.notifier.log ("IDS_NOTIFY_ADDED_ITEM", filePath, track.getName (), Parameter.formatNumber (startTime));
        return item;
    }


    /**
     * Set the tempo of the project.
     *
     * @param bpm The tempo in beats per minute
     * @throws ValidationException The tempo is out of range
     */
    public void setTempo (final double bpm) throws ValidationException
    {
        ReaperProjectEditor.setTempo (this.document, bpm);
        this.notifier.log ("IDS_NOTIFY_SET_TEMPO", Parameter.formatNumber (bpm));
    }


    /**
     * Describe the current state of the project.
     *
     * @return The description
     * @throws ReaperProjectException The project contains malformed tracks or items
     */
    public String describe () throws ReaperProjectException
    {
        return ProjectSummary.describe (this.document);
    }


    /**
     * Does the project in memory differ from the stored file?
     *
     * @return True if there are unsaved changes
     */
    public boolean hasUnsavedChanges ()
    {
        return !ReaperProject.format (this.document).equals (this.lastKnownGood);
    }


    /**
     * Write the project to its' file.
     *
     * @throws IOException Could not write the file, the last saved state is kept
     */
    public void save () throws IOException
    {
        try
        {
            this.lastKnownGood = ReaperProjectFile.write (this.document, this.projectFile, this.notifier);
        }
        catch (final IOException ex)
        {
            this.notifier.logError ("IDS_NOTIFY_COULD_NOT_WRITE_FILE", ex);
            throw ex;
        }
        this.notifier.log ("IDS_NOTIFY_SAVED", this.projectFile.getAbsolutePath ());
    }


    /**
     * Discard all changes since the project was opened or last saved.
     *
     * @throws ReaperProjectException The stored text could not be parsed
     */
    public void rollback () throws ReaperProjectException
    {
        this.document = ReaperProject.parse (this.lastKnownGood);
        this.notifier.log ("IDS_NOTIFY_ROLLBACK");
    }
}
