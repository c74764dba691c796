package dev.jbang.apidiff.report;

import dev.jbang.apidiff.model.ChangeSet;
import dev.jbang.apidiff.model.DiffResult;
import java.util.List;

/**
 * Renders change-sets as Markdown. Items are printed in the order they were recorded; long lists
 * are truncated.
 */
public class ReportFormatter {
	static final int MAX_ITEMS = 10;
	static final int MAX_DEPENDENCIES = 20;

	public String formatDiffReport(DiffResult result) {
		StringBuilder sb = new StringBuilder();
		sb.append("# API Changes: ").append(result.packageId()).append('\n');
		sb.append("**").append(result.fromVersion()).append(" -> ").append(result.toVersion()).append("**\n\n");
		ChangeSet changes = result.changeSet();
		if (changes.isEmpty()) {
			sb.append("No API changes detected.\n");
		} else {
			sb.append(formatChangeSet(changes));
		}
		return sb.toString();
	}

	public String formatChangeSet(ChangeSet changes) {
		StringBuilder sb = new StringBuilder();

		if (changes.hasBreakingChanges()) {
			sb.append("## Breaking Changes\n");
			appendList(sb, changes.removedTypes(), "Removed Types");
			appendList(sb, changes.removedMethods(), "Removed Methods");
			appendList(sb, changes.removedProperties(), "Removed Properties");
			appendList(sb, changes.removedInterfaces(), "Removed Interfaces");
			appendList(sb, changes.baseClassChanges(), "Base Class Changes");
			appendList(sb, changes.asyncMigrations(), "Sync -> Async Migrations");
			appendList(sb, changes.namespaceChanges(), "Namespace Changes");
		}

		if (changes.hasDeprecations()) {
			sb.append("## Deprecations\n");
			appendList(sb, changes.obsoleteTypes(), "Obsolete Types");
			appendList(sb, changes.obsoleteMethods(), "Obsolete Methods");
		}

		if (changes.hasAdditions()) {
			sb.append("## New Features\n");
			appendList(sb, changes.addedTypes(), "New Types");
			appendList(sb, changes.addedMethods(), "New Methods");
			appendList(sb, changes.addedProperties(), "New Properties");
			appendList(sb, changes.addedInterfaces(), "New Interfaces");
		}

		if (changes.isMetaPackage()) {
			List<String> dependencies = changes.metaDependencies();
			sb.append("## Meta-Package\n");
			sb.append("This package contains no classes, only dependencies:\n");
			dependencies.stream().limit(MAX_DEPENDENCIES).forEach(dep -> sb.append("- ").append(dep).append('\n'));
			if (dependencies.size() > MAX_DEPENDENCIES) {
				int more = dependencies.size() - MAX_DEPENDENCIES;
				sb.append("... and ").append(more).append(more == 1 ? " more dependency\n" : " more dependencies\n");
			}
		}

		if (changes.comparisonError() != null) {
			sb.append("\n**Warning:** ").append(changes.comparisonError()).append('\n');
		}
		return sb.toString();
	}

	private static void appendList(StringBuilder sb, List<String> items, String header) {
		if (items.isEmpty()) {
			return;
		}
		sb.append("### ").append(header).append(" (").append(items.size()).append(")\n");
		items.stream().limit(MAX_ITEMS).forEach(item -> sb.append("- ").append(item).append('\n'));
		if (items.size() > MAX_ITEMS) {
			int more = items.size() - MAX_ITEMS;
			sb.append("- ... and ").append(more).append(more == 1 ? " more item\n" : " more items\n");
		}
		sb.append('\n');
	}
}
