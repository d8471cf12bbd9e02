package net.scoreworks.test_model;

public class Note {
    private final Track track;
    private int pitch;

    public Note(Track track, int pitch) {
        this.track = track;
        this.pitch = pitch;
        if (track != null)
            track.addNote(this);
    }

    public Track getTrack() {
        return track;
    }

    public int getPitch() {
        return pitch;
    }

    public void setPitch(int pitch) {
        this.pitch = pitch;
    }

    @Override
    public String toString() {
        return "Note[" + pitch + "]";
    }
}
