package dev.blanke.ilpatcher.module;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An entry of the PE section table, relating a contiguous region of the file to the range of relative virtual
 * addresses it occupies once loaded.
 *
 * @param name The section name, e.g. {@code .text}, without trailing {@code NUL} padding.
 *
 * @param virtualAddress The RVA of the first byte of the section once loaded.
 *
 * @param virtualSize The size of the section once loaded.
 *
 * @param sizeOfRawData The size of the section's initialized data in the file.
 *
 * @param pointerToRawData The file offset of the section's initialized data.
 */
public record SectionHeader(String name, int virtualAddress, int virtualSize, int sizeOfRawData,
                            int pointerToRawData) {

    public SectionHeader {
        Objects.requireNonNull(name);
    }

    /**
     * Checks whether the provided RVA lies inside this section.
     * <p>
     * The extent of a section is the larger of its virtual and raw size, as linkers are free to pick either one
     * as the smaller value.
     *
     * @param rva The relative virtual address to check.
     *
     * @return {@code true} if {@code rva} belongs to this section.
     */
    public boolean contains(final int rva) {
        final long start = Integer.toUnsignedLong(virtualAddress);
        final long size  = Math.max(Integer.toUnsignedLong(virtualSize), Integer.toUnsignedLong(sizeOfRawData));
        final long value = Integer.toUnsignedLong(rva);
        return (value >= start) && (value < start + size);
    }

    /**
     * Maps an RVA contained in this section to its file offset.
     *
     * @param rva A relative virtual address for which {@link #contains(int)} holds.
     *
     * @return {@code rva - virtualAddress + pointerToRawData}.
     */
    public long toFileOffset(final int rva) {
        return Integer.toUnsignedLong(rva) - Integer.toUnsignedLong(virtualAddress)
            + Integer.toUnsignedLong(pointerToRawData);
    }

    /**
     * Returns the first section of the table whose virtual address range contains the provided RVA.
     *
     * @param sections The section table to scan.
     *
     * @param rva The relative virtual address to locate.
     *
     * @return The containing section, or an empty {@code Optional} if the RVA lies outside of every section.
     */
    public static Optional<SectionHeader> find(final List<SectionHeader> sections, final int rva) {
        return sections.stream().filter(section -> section.contains(rva)).findFirst();
    }
}
