import java.util.ArrayList;
import java.util.List;

import com.ember.script.runtime.OutputSink;

/** Collects script output for assertions. */
public class RecordingOutputSink implements OutputSink {

    public static final class Echo {
        public final String text;
        public final String preset;

        Echo(String text, String preset) {
            this.text = text;
            this.preset = preset;
        }

        @Override
        public String toString() { return preset + ": " + text; }
    }

    private final List<Echo> echoes = new ArrayList<>();
    private final List<String> commands = new ArrayList<>();

    @Override
    public synchronized void echo(String text, String preset) {
        echoes.add(new Echo(text, preset));
    }

    @Override
    public synchronized void sendCommand(String command) {
        commands.add(command);
    }

    /** Text echoed by {@code echo} lines only. */
    public synchronized List<String> echoes() {
        return withPreset(OutputSink.ECHO);
    }

    public synchronized List<String> errors() {
        return withPreset(OutputSink.ERROR);
    }

    public synchronized List<String> infos() {
        return withPreset(OutputSink.INFO);
    }

    public synchronized List<String> commands() {
        return new ArrayList<>(commands);
    }

    public synchronized boolean hasErrorContaining(String fragment) {
        for (String e : errors()) {
            if (e.contains(fragment)) return true;
        }
        return false;
    }

    private List<String> withPreset(String preset) {
        List<String> out = new ArrayList<>();
        for (Echo e : echoes) {
            if (e.preset.equals(preset)) out.add(e.text);
        }
        return out;
    }
}
