package org.javai.mermaid.batch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.javai.mermaid.DiagramParser;
import org.javai.mermaid.ParseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses many named diagrams on a fixed thread pool, one diagram per task.
 * <p>
 * Parsers keep all state per call, so a single parser instance is shared by
 * every task. Results come back in the order the sources were given.
 *
 * @param <D> the diagram type
 */
public class BatchParser<D> implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(BatchParser.class);

	private final DiagramParser<D> parser;
	private final ExecutorService executor;

	public BatchParser(DiagramParser<D> parser, int parallelism) {
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		if (parallelism < 1) {
			throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
		}
		this.executor = Executors.newFixedThreadPool(parallelism);
	}

	/**
	 * Parses every source.
	 *
	 * @param sources diagram text keyed by a caller-chosen name
	 * @return the outcome for each name, in the iteration order of {@code sources}
	 * @throws IllegalStateException if the calling thread is interrupted while waiting
	 */
	public BatchReport<D> parseAll(Map<String, String> sources) {
		Objects.requireNonNull(sources, "sources must not be null");
		List<String> names = new ArrayList<>(sources.keySet());
		List<Future<ParseOutcome<D>>> futures = new ArrayList<>();
		for (String name : names) {
			String text = sources.get(name);
			futures.add(executor.submit(() -> parser.parse(text)));
		}

		Map<String, ParseOutcome<D>> outcomes = new LinkedHashMap<>();
		try {
			for (int i = 0; i < names.size(); i++) {
				outcomes.put(names.get(i), futures.get(i).get());
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			futures.forEach(f -> f.cancel(true));
			throw new IllegalStateException("Interrupted while waiting for batch parse", e);
		} catch (ExecutionException e) {
			futures.forEach(f -> f.cancel(true));
			if (e.getCause() instanceof RuntimeException re) {
				throw re;
			}
			throw new IllegalStateException("Batch parse task failed", e.getCause());
		}

		BatchReport<D> report = new BatchReport<>(outcomes);
		logger.debug("Parsed {} diagrams with '{}': {} succeeded, {} failed, {} warnings",
				outcomes.size(), parser.grammarId(), report.successCount(), report.failureCount(),
				report.warningCount());
		return report;
	}

	/**
	 * Stops accepting work and waits briefly for running tasks.
	 */
	@Override
	public void close() {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
