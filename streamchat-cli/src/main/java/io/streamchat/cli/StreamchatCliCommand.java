package io.streamchat.cli;

import picocli.CommandLine.Command;

@Command(name = "streamchat", mixinStandardHelpOptions = true, description = "Streaming chat client for OpenAI-compatible APIs")
public final class StreamchatCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
