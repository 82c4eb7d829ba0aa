package com.example.redline.cli;

import com.example.redline.exception.RedlineException;
import com.example.redline.model.DocumentType;
import com.example.redline.model.RedlineOptions;
import com.example.redline.model.RedlineOutcome;
import com.example.redline.service.DocumentRedliner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * 命令行入口
 *
 * 退出码：0 成功，1 用法错误，2 文档解析 / 包错误，3 写出错误。
 */
@Command(name = "redline", mixinStandardHelpOptions = true, version = "redline 0.0.1",
        description = "比对 docx / xlsx / pptx 并生成修订标记",
        exitCodeOnInvalidInput = RedlineCli.EXIT_USAGE,
        subcommands = {
                RedlineCli.CompareCommand.class,
                RedlineCli.ChangesCommand.class,
                RedlineCli.ApplyCommand.class,
                RedlineCli.RevertCommand.class
        })
public class RedlineCli implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_PARSE = 2;
    public static final int EXIT_WRITE = 3;

    @Spec
    CommandLine.Model.CommandSpec spec;

    final DocumentRedliner redliner = new DocumentRedliner();

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_USAGE;
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * 配置好异常处理的命令行
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new RedlineCli());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("参数错误: " + ex.getMessage());
                return EXIT_USAGE;
            } else if (ex instanceof RedlineException && ((RedlineException) ex).isInputError()) {
                commandLine.getErr().println("文档错误: " + ex.getMessage());
                return EXIT_PARSE;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("写出失败: " + ex.getMessage());
                return EXIT_WRITE;
            } else {
                commandLine.getErr().println("错误: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_WRITE;
            }
        });
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.usage(failed.getErr());
            return EXIT_USAGE;
        });
        return cmd;
    }

    // ==================== 公共 ====================

    static DocumentType typeOf(Path path) {
        DocumentType type = DocumentType.fromFileName(path.getFileName().toString());
        if (type == null) {
            throw new IllegalArgumentException("只支持.docx、.xlsx、.pptx文件: " + path);
        }
        return type;
    }

    static DocumentType pairType(Path oldPath, Path newPath) {
        DocumentType oldType = typeOf(oldPath);
        DocumentType newType = typeOf(newPath);
        if (oldType != newType) {
            throw new IllegalArgumentException("两个文件类型不一致: " + oldType + " / " + newType);
        }
        return newType;
    }

    /**
     * 读取输入文件；读不到属于输入错误
     */
    static byte[] read(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw RedlineException.packageError(path.toString(), "无法读取文件", e);
        }
    }

    static void write(Path path, byte[] bytes) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, bytes);
    }

    // ==================== 子命令 ====================

    @Command(name = "compare", description = "比对两个文档，输出带修订标记的新文档",
            exitCodeOnInvalidInput = EXIT_USAGE, mixinStandardHelpOptions = true)
    static class CompareCommand implements Callable<Integer> {

        @ParentCommand
        RedlineCli parent;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Option(names = "--old", required = true, paramLabel = "<path>", description = "旧文档")
        Path oldPath;

        @Option(names = "--new", required = true, paramLabel = "<path>", description = "新文档")
        Path newPath;

        @Option(names = "--out", required = true, paramLabel = "<path>", description = "输出文档")
        Path outPath;

        @Option(names = "--author", paramLabel = "<name>", description = "修订作者")
        String author;

        @Option(names = "--date", paramLabel = "<iso-8601>", description = "修订时间")
        String date;

        @Option(names = "--detail-threshold", paramLabel = "<0..1>", description = "段落相似度阈值（Word）")
        Double detailThreshold;

        @Option(names = "--track-formatting", description = "记录格式变更")
        Boolean trackFormatting;

        @Override
        public Integer call() throws IOException {
            DocumentType type = pairType(oldPath, newPath);
            if (detailThreshold != null && (detailThreshold < 0 || detailThreshold > 1)) {
                throw new IllegalArgumentException("--detail-threshold 必须在 0 到 1 之间: " + detailThreshold);
            }
            RedlineOptions options = new RedlineOptions(author, date, detailThreshold, trackFormatting);
            RedlineOutcome outcome = parent.redliner.compare(type, read(oldPath), read(newPath), options);
            write(outPath, outcome.getDocument());
            spec.commandLine().getOut().println("revisions: " + outcome.getRevisionCount() + " -> " + outPath);
            return EXIT_OK;
        }
    }

    @Command(name = "changes", description = "列出两个文档之间的变更",
            exitCodeOnInvalidInput = EXIT_USAGE, mixinStandardHelpOptions = true)
    static class ChangesCommand implements Callable<Integer> {

        @ParentCommand
        RedlineCli parent;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Option(names = "--old", required = true, paramLabel = "<path>", description = "旧文档")
        Path oldPath;

        @Option(names = "--new", required = true, paramLabel = "<path>", description = "新文档")
        Path newPath;

        @Option(names = "--json", description = "输出变更 JSON（可作为 apply / revert 的输入）")
        boolean json;

        @Override
        public Integer call() {
            DocumentType type = pairType(oldPath, newPath);
            RedlineOutcome outcome = parent.redliner.changes(type, read(oldPath), read(newPath), null);
            PrintWriter out = spec.commandLine().getOut();
            if (json) {
                out.println(parent.redliner.toJson(outcome.getChanges()));
            } else {
                JsonNode items = new ObjectMapper().valueToTree(outcome.getItems());
                for (JsonNode item : items) {
                    out.println("[" + item.path("id").asText() + "] " + item.path("summary").asText());
                }
                out.println("total: " + outcome.getRevisionCount());
            }
            out.flush();
            return EXIT_OK;
        }
    }

    @Command(name = "apply", description = "Word 接受列出的修订；Excel / PowerPoint 把列出的变更写入旧文档",
            exitCodeOnInvalidInput = EXIT_USAGE, mixinStandardHelpOptions = true)
    static class ApplyCommand implements Callable<Integer> {

        @ParentCommand
        RedlineCli parent;

        @Option(names = "--base", required = true, paramLabel = "<path>", description = "基础文档")
        Path basePath;

        @Option(names = "--changes", required = true, paramLabel = "<json>", description = "变更 JSON 文件")
        Path changesPath;

        @Option(names = "--out", required = true, paramLabel = "<path>", description = "输出文档")
        Path outPath;

        @Override
        public Integer call() throws IOException {
            DocumentType type = typeOf(basePath);
            byte[] changes = readChanges(changesPath);
            write(outPath, parent.redliner.apply(type, read(basePath), changes));
            return EXIT_OK;
        }
    }

    @Command(name = "revert", description = "Word 拒绝列出的修订；Excel / PowerPoint 在比对结果上撤销列出的变更",
            exitCodeOnInvalidInput = EXIT_USAGE, mixinStandardHelpOptions = true)
    static class RevertCommand implements Callable<Integer> {

        @ParentCommand
        RedlineCli parent;

        @Option(names = "--result", required = true, paramLabel = "<path>", description = "比对结果文档")
        Path resultPath;

        @Option(names = "--changes", required = true, paramLabel = "<json>", description = "变更 JSON 文件")
        Path changesPath;

        @Option(names = "--out", required = true, paramLabel = "<path>", description = "输出文档")
        Path outPath;

        @Override
        public Integer call() throws IOException {
            DocumentType type = typeOf(resultPath);
            byte[] changes = readChanges(changesPath);
            write(outPath, parent.redliner.revert(type, read(resultPath), changes));
            return EXIT_OK;
        }
    }

    static byte[] readChanges(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new IllegalArgumentException("无法读取变更文件: " + path, e);
        }
    }
}
