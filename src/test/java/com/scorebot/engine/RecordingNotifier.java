package com.scorebot.engine;

import com.scorebot.engine.output.Notifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class RecordingNotifier implements Notifier {
    public final List<String> sent = Collections.synchronizedList(new ArrayList<>());
    private final boolean failing;

    public RecordingNotifier() {
        this(false);
    }

    public RecordingNotifier(boolean failing) {
        this.failing = failing;
    }

    @Override
    public boolean sendNotification(String ticker, String rationale) {
        if (failing) {
            throw new IllegalStateException("smtp down");
        }
        sent.add(ticker);
        return true;
    }
}
