package com.flamingo.ai.knowledge.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/** Top-level command; a subcommand is required. */
@Component
@Command(
    name = "knowledge",
    description = "Builds lexical retrieval knowledge bases from structured documents",
    mixinStandardHelpOptions = true,
    subcommands = {BuildKnowledgeCommand.class, DocxToTextCommand.class})
public class KnowledgeCli {}
