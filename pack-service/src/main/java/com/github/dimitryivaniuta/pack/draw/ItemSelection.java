package com.github.dimitryivaniuta.pack.draw;

import com.github.dimitryivaniuta.pack.catalog.Item;

/** Item chosen for one slot, and whether the guarantee was spent on it. */
public record ItemSelection(Item item, boolean guaranteeConsumed) {}
