package org.zmachine3.runtime.model;

import org.zmachine3.runtime.Config;
import org.zmachine3.runtime.api.ZMachineException;
import org.zmachine3.runtime.text.ZText;

/**
 * The object tree of a version 3 story, stored in memory.
 * <p>
 * Objects are addressed by number; parent, sibling and child links are object numbers held in the
 * fixed 9-byte entries, so the tree is relinked purely by rewriting those bytes.
 */
public class ObjectTable {

    private static final int ATTRIBUTES_OFFSET = 0;
    private static final int PARENT_OFFSET = 4;
    private static final int SIBLING_OFFSET = 5;
    private static final int CHILD_OFFSET = 6;
    private static final int PROPERTIES_OFFSET = 7;

    private final Memory memory;
    private final ZText text;
    private final int tableAddress;
    private final int entriesAddress;
    private final int objectCount;

    public ObjectTable(Memory memory, int tableAddress, ZText text) {
        this.memory = memory;
        this.text = text;
        this.tableAddress = tableAddress;
        this.entriesAddress = tableAddress + Config.PROPERTY_DEFAULTS_COUNT * 2;
        this.objectCount = countObjects();
    }

    // Entries end where the first property table begins.
    private int countObjects() {
        int lowestProperties = memory.size();
        int count = 0;
        while (count < Config.MAX_OBJECTS) {
            int entry = entriesAddress + count * Config.OBJECT_ENTRY_SIZE;
            if (entry + Config.OBJECT_ENTRY_SIZE > lowestProperties || entry + Config.OBJECT_ENTRY_SIZE > memory.size()) {
                break;
            }
            lowestProperties = Math.min(lowestProperties, memory.readWord(entry + PROPERTIES_OFFSET));
            count++;
        }
        return count;
    }

    /**
     * Returns the number of objects in the table.
     * @return The highest valid object number.
     */
    public int getObjectCount() {
        return objectCount;
    }

    public boolean getAttribute(int obj, int attribute) {
        int address = attributeByte(obj, attribute);
        return (memory.readByte(address) & attributeMask(attribute)) != 0;
    }

    public void setAttribute(int obj, int attribute, boolean value) {
        int address = attributeByte(obj, attribute);
        int current = memory.readByte(address);
        int mask = attributeMask(attribute);
        memory.writeByte(address, value ? current | mask : current & ~mask);
    }

    public int getParent(int obj) {
        return memory.readByte(entry(obj) + PARENT_OFFSET);
    }

    public int getSibling(int obj) {
        return memory.readByte(entry(obj) + SIBLING_OFFSET);
    }

    public int getChild(int obj) {
        return memory.readByte(entry(obj) + CHILD_OFFSET);
    }

    private void setParent(int obj, int parent) {
        memory.writeByte(entry(obj) + PARENT_OFFSET, parent);
    }

    private void setSibling(int obj, int sibling) {
        memory.writeByte(entry(obj) + SIBLING_OFFSET, sibling);
    }

    private void setChild(int obj, int child) {
        memory.writeByte(entry(obj) + CHILD_OFFSET, child);
    }

    /**
     * Detaches an object from its parent. Its parent and sibling links become 0; its own children
     * move with it.
     * @param obj The object to detach.
     */
    public void removeObject(int obj) {
        int parent = getParent(obj);
        if (parent == 0) {
            return;
        }
        int current = getChild(parent);
        if (current == obj) {
            setChild(parent, getSibling(obj));
        } else {
            int previous = 0;
            while (current != obj) {
                if (current == 0) {
                    throw new ZMachineException("Corrupted object tree: object " + obj
                            + " not found among the children of " + parent);
                }
                previous = current;
                current = getSibling(current);
            }
            setSibling(previous, getSibling(obj));
        }
        setParent(obj, 0);
        setSibling(obj, 0);
    }

    /**
     * Moves an object to become the first child of {@code destination}.
     * <p>
     * The removal completes before the destination's child pointer is read, so moving an object that
     * is already inside the destination's subtree keeps the remaining siblings intact.
     * @param obj The object to move.
     * @param destination The new parent.
     */
    public void insertObject(int obj, int destination) {
        entry(destination);
        removeObject(obj);
        int firstChild = getChild(destination);
        setSibling(obj, firstChild);
        setChild(destination, obj);
        setParent(obj, destination);
    }

    /**
     * Returns the value of a property, or the default value if the object lacks it.
     * @param obj The object.
     * @param property The property number 1..31.
     * @return The 1- or 2-byte property value.
     */
    public int getProperty(int obj, int property) {
        checkPropertyNumber(property);
        int address = getPropertyAddress(obj, property);
        if (address == 0) {
            return memory.readWord(tableAddress + 2 * (property - 1));
        }
        int length = getPropertyLength(address);
        return switch (length) {
            case 1 -> memory.readByte(address);
            case 2 -> memory.readWord(address);
            default -> throw new ZMachineException("get_prop on property " + property + " of object " + obj
                    + " with length " + length);
        };
    }

    /**
     * Writes a property value. The object must have the property.
     * @param obj The object.
     * @param property The property number.
     * @param value The new value; truncated to a byte for 1-byte properties.
     */
    public void putProperty(int obj, int property, int value) {
        checkPropertyNumber(property);
        int address = getPropertyAddress(obj, property);
        if (address == 0) {
            throw new ZMachineException("put_prop on missing property " + property + " of object " + obj);
        }
        int length = getPropertyLength(address);
        switch (length) {
            case 1 -> memory.writeByte(address, value);
            case 2 -> memory.writeWord(address, value);
            default -> throw new ZMachineException("put_prop on property " + property + " of object " + obj
                    + " with length " + length);
        }
    }

    /**
     * Finds the data address of a property.
     * @param obj The object.
     * @param property The property number.
     * @return The address of the first data byte, or 0 if the object has no such property.
     */
    public int getPropertyAddress(int obj, int property) {
        int sizeAddress = firstPropertySizeAddress(obj);
        while (true) {
            int size = memory.readByte(sizeAddress);
            int number = size & 0x1F;
            if (size == 0 || number < property) {
                return 0;
            }
            if (number == property) {
                return sizeAddress + 1;
            }
            sizeAddress += 1 + (size >> 5) + 1;
        }
    }

    /**
     * Returns the data length of the property whose data starts at {@code address}.
     * @param address A property data address, or 0.
     * @return The length 1..8, or 0 for address 0.
     */
    public int getPropertyLength(int address) {
        if (address == 0) {
            return 0;
        }
        return (memory.readByte(address - 1) >> 5) + 1;
    }

    /**
     * Returns the number of the property after {@code property} in the object's list.
     * @param obj The object.
     * @param property 0 for the first property, otherwise an existing property number.
     * @return The next property number, or 0 after the last one.
     */
    public int getNextProperty(int obj, int property) {
        int sizeAddress = firstPropertySizeAddress(obj);
        if (property != 0) {
            int address = getPropertyAddress(obj, property);
            if (address == 0) {
                throw new ZMachineException("get_next_prop on missing property " + property + " of object " + obj);
            }
            sizeAddress = address + getPropertyLength(address);
        }
        return memory.readByte(sizeAddress) & 0x1F;
    }

    /**
     * Decodes the short name stored at the head of the object's property table.
     * @param obj The object.
     * @return The name, empty if it has none.
     */
    public String getShortName(int obj) {
        int propertyTable = memory.readWord(entry(obj) + PROPERTIES_OFFSET);
        if (memory.readByte(propertyTable) == 0) {
            return "";
        }
        return text.decode(propertyTable + 1).text();
    }

    private int firstPropertySizeAddress(int obj) {
        int propertyTable = memory.readWord(entry(obj) + PROPERTIES_OFFSET);
        return propertyTable + 1 + 2 * memory.readByte(propertyTable);
    }

    private int entry(int obj) {
        if (obj < 1 || obj > objectCount) {
            throw new ZMachineException("Invalid object number " + obj + " (table holds " + objectCount + ")");
        }
        return entriesAddress + (obj - 1) * Config.OBJECT_ENTRY_SIZE;
    }

    private int attributeByte(int obj, int attribute) {
        if (attribute < 0 || attribute >= Config.ATTRIBUTE_COUNT) {
            throw new ZMachineException("Invalid attribute " + attribute + " on object " + obj);
        }
        return entry(obj) + ATTRIBUTES_OFFSET + attribute / 8;
    }

    private static int attributeMask(int attribute) {
        return 0x80 >> (attribute % 8);
    }

    private static void checkPropertyNumber(int property) {
        if (property < 1 || property > Config.PROPERTY_DEFAULTS_COUNT) {
            throw new ZMachineException("Invalid property number " + property);
        }
    }
}
