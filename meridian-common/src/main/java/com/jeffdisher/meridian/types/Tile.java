package com.jeffdisher.meridian.types;


/**
 * A block entity:  extra state attached to a single block (a chest, a sign, a furnace).
 * 
 * @param id The process-unique tile id.
 * @param type The name of the tile type (opaque to the indexes).
 * @param location The block holding this tile.
 */
public record Tile(int id, String type, AbsoluteLocation location)
{
}
