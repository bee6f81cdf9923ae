/**
 * Filesystem ingestion.
 *
 * <p>{@link com.gentoro.onepress.datasource.FilesystemDataSource} turns a site source root into
 * {@link com.gentoro.onepress.datasource.item.Item}s: files are enumerated by {@link
 * com.gentoro.onepress.datasource.fs.FileWalker}, classified as text or binary, given their
 * explicit attributes by {@link com.gentoro.onepress.datasource.attributes.AttributeExtractor} and
 * their derived attributes by the filename and category rules, then stored per role.
 *
 * <h2>Configuration</h2>
 *
 * <ul>
 *   <li>{@code datasource.source_root}: directory holding {@code content/}, {@code layouts/} and
 *       {@code includes/}. Required.
 *   <li>{@code datasource.text_extensions}: extensions loaded as text; everything else is binary.
 *       Required.
 *   <li>{@code datasource.include} / {@code datasource.exclude}: forced additions and removals.
 *   <li>{@code datasource.attribute_syntax}: {@code yaml} (default) or {@code json}.
 *   <li>{@code datasource.timezone}: zone used to format {@code mtime}; system zone by default.
 * </ul>
 */
package com.gentoro.onepress.datasource;
