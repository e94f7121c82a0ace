/*
 * Copyright (C) 2018 Jean Ollion
 * Copyright (C) 2026 Kymograph contributors
 *
 * This File is part of KYMOGRAPH
 *
 * KYMOGRAPH is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * KYMOGRAPH is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with KYMOGRAPH.  If not, see <http://www.gnu.org/licenses/>.
 */
package kymograph.processing;

import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.interpolation.randomaccess.LanczosInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NearestNeighborInterpolatorFactory;

import java.util.function.Supplier;

/**
 * Interpolation used when rotating sampled tiles. BICUBIC relies on ImageJ, the others on ImgLib2 interpolators
 */
public enum Interpolation {
    BICUBIC(null),
    NEAREST(NearestNeighborInterpolatorFactory::new),
    NLINEAR(NLinearInterpolatorFactory::new),
    LANCZOS3(()->new LanczosInterpolatorFactory(3, false)),
    LANCZOS5(()->new LanczosInterpolatorFactory(5, false));
    private final Supplier<InterpolatorFactory> factory;
    Interpolation(Supplier<InterpolatorFactory> factory) {
        this.factory=factory;
    }
    public InterpolatorFactory factory() {
        if (factory==null) throw new UnsupportedOperationException(name()+" interpolation is not backed by an ImgLib2 interpolator");
        return factory.get();
    }
    public Rotator getRotator() {
        if (factory==null) return new IJRotator();
        else return new ImgLib2Rotator(this);
    }
}
